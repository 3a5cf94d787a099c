package br.com.fantasyflicks.backend.domain.repository;

import br.com.fantasyflicks.backend.domain.entity.DraftSessionEntity;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DraftSessionRepository extends JpaRepository<DraftSessionEntity, Long> {

    List<DraftSessionEntity> findByStatus(DraftStatus status);

    /**
     * ✅ Compare-and-swap da sessão: só grava se a versão armazenada ainda for
     * {@code expectedVersion}.
     *
     * @return 1 se gravou, 0 se outra escrita chegou antes
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DraftSessionEntity s SET " +
            "s.status = :status, " +
            "s.currentOverallPick = :currentOverallPick, " +
            "s.currentPickerId = :currentPickerId, " +
            "s.turnStartedAt = :turnStartedAt, " +
            "s.scheduledAt = :scheduledAt, " +
            "s.startedAt = :startedAt, " +
            "s.pausedAt = :pausedAt, " +
            "s.completedAt = :completedAt, " +
            "s.updatedAt = :updatedAt, " +
            "s.stateVersion = :newVersion " +
            "WHERE s.id = :id AND s.stateVersion = :expectedVersion")
    int compareAndSet(@Param("id") Long id,
            @Param("expectedVersion") long expectedVersion,
            @Param("newVersion") long newVersion,
            @Param("status") DraftStatus status,
            @Param("currentOverallPick") int currentOverallPick,
            @Param("currentPickerId") String currentPickerId,
            @Param("turnStartedAt") Instant turnStartedAt,
            @Param("scheduledAt") Instant scheduledAt,
            @Param("startedAt") Instant startedAt,
            @Param("pausedAt") Instant pausedAt,
            @Param("completedAt") Instant completedAt,
            @Param("updatedAt") Instant updatedAt);
}
