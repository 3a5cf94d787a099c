package br.com.fantasyflicks.backend.service.store;

import br.com.fantasyflicks.backend.domain.entity.DraftSessionEntity;
import br.com.fantasyflicks.backend.domain.entity.SelectionEntity;
import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.ScoringSettings;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.domain.repository.DraftSessionRepository;
import br.com.fantasyflicks.backend.domain.repository.SelectionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * ✅ Store JPA (MySQL em produção).
 * 
 * O compare-and-swap é um UPDATE condicional em {@code state_version}; o pick
 * é inserido na mesma transação. A chave única (session_id,
 * overall_pick_number) garante a sequência contígua mesmo se dois nós
 * chegarem juntos.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.draft.store", havingValue = "jpa", matchIfMissing = true)
public class JpaDraftSessionStore implements DraftSessionStore {

    private static final TypeReference<List<String>> ORDER_TYPE = new TypeReference<>() {
    };

    private final DraftSessionRepository sessionRepository;
    private final SelectionRepository selectionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public DraftSession create(DraftSession session) {
        DraftSessionEntity saved = sessionRepository.save(toEntity(session));
        log.info("✅ [JpaStore] Sessão {} criada", saved.getId());
        return toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DraftSession> find(Long sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return sessionRepository.findById(sessionId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Selection> selections(Long sessionId) {
        return selectionRepository.findBySessionIdOrderByOverallPickNumberAsc(sessionId).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<DraftSession> findByStatus(DraftStatus status) {
        return sessionRepository.findByStatus(status).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public boolean compareAndSet(DraftSession next, long expectedVersion, Selection appended) {
        int updated = sessionRepository.compareAndSet(
                next.getId(),
                expectedVersion,
                next.getVersion(),
                next.getStatus(),
                next.getCurrentOverallPick(),
                next.getCurrentPickerId(),
                next.getTurnStartedAt(),
                next.getScheduledAt(),
                next.getStartedAt(),
                next.getPausedAt(),
                next.getCompletedAt(),
                clock.instant());

        if (updated == 0) {
            log.debug("[JpaStore] CAS perdido na sessão {} (versão esperada {})", next.getId(), expectedVersion);
            return false;
        }

        if (appended != null) {
            selectionRepository.save(toEntity(appended));
        }
        return true;
    }

    private DraftSessionEntity toEntity(DraftSession session) {
        DraftConfiguration config = session.getConfiguration();
        ScoringSettings scoring = config.getScoring();
        return DraftSessionEntity.builder()
                .id(session.getId())
                .leagueId(config.getLeagueId())
                .commissionerId(config.getCommissionerId())
                .poolId(config.getPoolId())
                .draftOrderJson(writeOrder(config.getOrder()))
                .discipline(config.getDiscipline())
                .roundsTotal(config.getRoundsTotal())
                .turnBudgetSeconds(config.getTurnBudgetSeconds())
                .eligibilityMode(config.getEligibilityMode())
                .categoryStyle(config.getCategoryStyle())
                .allowDuplicatePicks(config.isAllowDuplicatePicks())
                .sharedOwnership(config.isSharedOwnership())
                .fallbackPolicy(config.getFallbackPolicy())
                .scoringMode(scoring.getMode())
                .tiebreakMetric(scoring.getTiebreak())
                .pointsPerCorrectPick(scoring.getPointsPerCorrectPick())
                .scoringDirection(scoring.getDirection())
                .status(session.getStatus())
                .currentOverallPick(session.getCurrentOverallPick())
                .currentPickerId(session.getCurrentPickerId())
                .turnStartedAt(session.getTurnStartedAt())
                .stateVersion(session.getVersion())
                .createdAt(session.getCreatedAt())
                .scheduledAt(session.getScheduledAt())
                .startedAt(session.getStartedAt())
                .pausedAt(session.getPausedAt())
                .completedAt(session.getCompletedAt())
                .updatedAt(clock.instant())
                .build();
    }

    private DraftSession toDomain(DraftSessionEntity entity) {
        DraftConfiguration config = DraftConfiguration.builder()
                .leagueId(entity.getLeagueId())
                .commissionerId(entity.getCommissionerId())
                .poolId(entity.getPoolId())
                .order(readOrder(entity.getDraftOrderJson()))
                .discipline(entity.getDiscipline())
                .roundsTotal(entity.getRoundsTotal())
                .turnBudgetSeconds(entity.getTurnBudgetSeconds())
                .eligibilityMode(entity.getEligibilityMode())
                .categoryStyle(entity.getCategoryStyle())
                .allowDuplicatePicks(entity.isAllowDuplicatePicks())
                .sharedOwnership(entity.isSharedOwnership())
                .fallbackPolicy(entity.getFallbackPolicy())
                .scoring(ScoringSettings.builder()
                        .mode(entity.getScoringMode())
                        .tiebreak(entity.getTiebreakMetric())
                        .pointsPerCorrectPick(entity.getPointsPerCorrectPick())
                        .direction(entity.getScoringDirection())
                        .build())
                .build();

        return DraftSession.builder()
                .id(entity.getId())
                .configuration(config)
                .status(entity.getStatus())
                .currentOverallPick(entity.getCurrentOverallPick())
                .currentPickerId(entity.getCurrentPickerId())
                .turnStartedAt(entity.getTurnStartedAt())
                .version(entity.getStateVersion())
                .createdAt(entity.getCreatedAt())
                .scheduledAt(entity.getScheduledAt())
                .startedAt(entity.getStartedAt())
                .pausedAt(entity.getPausedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }

    private SelectionEntity toEntity(Selection selection) {
        return SelectionEntity.builder()
                .sessionId(selection.sessionId())
                .overallPickNumber(selection.overallPickNumber())
                .roundNumber(selection.roundNumber())
                .positionInRound(selection.positionInRound())
                .pickerId(selection.pickerId())
                .itemId(selection.itemId())
                .committedAt(selection.committedAt())
                .autoSelected(selection.autoSelected())
                .build();
    }

    private Selection toDomain(SelectionEntity entity) {
        return new Selection(
                entity.getSessionId(),
                entity.getOverallPickNumber(),
                entity.getRoundNumber(),
                entity.getPositionInRound(),
                entity.getPickerId(),
                entity.getItemId(),
                entity.getCommittedAt(),
                entity.isAutoSelected());
    }

    private String writeOrder(List<String> order) {
        try {
            return objectMapper.writeValueAsString(order);
        } catch (JsonProcessingException e) {
            log.error("❌ [JpaStore] Erro ao serializar ordem do draft", e);
            throw new IllegalStateException("Erro ao serializar ordem do draft", e);
        }
    }

    private List<String> readOrder(String json) {
        try {
            return List.copyOf(objectMapper.readValue(json, ORDER_TYPE));
        } catch (JsonProcessingException e) {
            log.error("❌ [JpaStore] Erro ao ler ordem do draft: {}", json, e);
            throw new IllegalStateException("Ordem do draft corrompida", e);
        }
    }
}
