package br.com.fantasyflicks.backend.domain.repository;

import br.com.fantasyflicks.backend.domain.entity.SelectionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SelectionRepository extends JpaRepository<SelectionEntity, Long> {

    List<SelectionEntity> findBySessionIdOrderByOverallPickNumberAsc(Long sessionId);

    long countBySessionId(Long sessionId);
}
