package br.com.fantasyflicks.backend.domain.repository;

import br.com.fantasyflicks.backend.domain.entity.CatalogCategoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogCategoryRepository extends JpaRepository<CatalogCategoryEntity, Long> {

    List<CatalogCategoryEntity> findByPoolIdOrderByDisplayOrderAsc(String poolId);

    void deleteByPoolId(String poolId);
}
