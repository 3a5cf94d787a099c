package br.com.fantasyflicks.backend.domain.repository;

import br.com.fantasyflicks.backend.domain.entity.CatalogItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CatalogItemRepository extends JpaRepository<CatalogItemEntity, Long> {

    List<CatalogItemEntity> findByPoolIdOrderByRankOrderAsc(String poolId);

    Optional<CatalogItemEntity> findByPoolIdAndItemId(String poolId, String itemId);

    void deleteByPoolId(String poolId);
}
