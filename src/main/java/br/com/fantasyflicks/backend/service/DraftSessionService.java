package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.config.properties.DraftProperties;
import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.domain.model.DraftOrderType;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.ScoringSettings;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.domain.model.StandingEntry;
import br.com.fantasyflicks.backend.dto.CreateDraftRequest;
import br.com.fantasyflicks.backend.dto.DraftSessionDTO;
import br.com.fantasyflicks.backend.exception.DraftNotFoundException;
import br.com.fantasyflicks.backend.exception.InvalidDraftConfigurationException;
import br.com.fantasyflicks.backend.exception.InvalidDraftTransitionException;
import br.com.fantasyflicks.backend.exception.NotCommissionerException;
import br.com.fantasyflicks.backend.mapper.DraftMapper;
import br.com.fantasyflicks.backend.service.catalog.CatalogSnapshot;
import br.com.fantasyflicks.backend.service.catalog.ItemCatalog;
import br.com.fantasyflicks.backend.service.eligibility.CategoryRoundsPolicy;
import br.com.fantasyflicks.backend.service.eligibility.EligibilityContext;
import br.com.fantasyflicks.backend.service.eligibility.EligibilityPolicies;
import br.com.fantasyflicks.backend.service.store.DraftSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * ✅ Ciclo de vida das sessões de draft
 * 
 * Criação, agendamento, início, pausa e retomada, além das consultas
 * (sessão, picks, itens disponíveis e classificação). Picks passam pelo
 * {@link PickCommitEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftSessionService {

    private final DraftSessionStore store;
    private final DraftSessionStateMachine stateMachine;
    private final TurnSequencer turnSequencer;
    private final TurnTimer turnTimer;
    private final StandingsAggregator standingsAggregator;
    private final ItemCatalog itemCatalog;
    private final DraftEventBroadcastService broadcastService;
    private final DraftMapper draftMapper;
    private final DraftProperties draftProperties;
    private final Clock clock;

    private final Random random = new Random();

    // ═══════════════════════════════════════════════════════════
    // CICLO DE VIDA
    // ═══════════════════════════════════════════════════════════

    /**
     * Cria um draft PENDING. Quem cria vira o comissário.
     *
     * @throws InvalidDraftConfigurationException se a configuração ou o pool
     *                                            não permitem o draft
     */
    public DraftSession createDraft(CreateDraftRequest request, String commissionerId) {
        DraftConfiguration config = buildConfiguration(request, commissionerId);
        config.validate();
        validateAgainstCatalog(config);

        DraftSession created = store.create(DraftSession.builder()
                .configuration(config)
                .status(DraftStatus.PENDING)
                .currentOverallPick(1)
                .version(0)
                .createdAt(clock.instant())
                .build());

        log.info("✅ [DraftSession] Draft {} criado por {}: {} participantes, {} rodadas, {} ({}s por pick)",
                created.getId(), commissionerId, config.participantCount(), config.getRoundsTotal(),
                config.getDiscipline(), config.getTurnBudgetSeconds());
        return created;
    }

    public DraftSession scheduleSession(Long sessionId, Instant scheduledAt, String caller, Long expectedVersion) {
        DraftSession current = requireCommissioner(sessionId, caller);
        if (expectedVersion != null && expectedVersion != current.getVersion()) {
            throw new InvalidDraftTransitionException(
                    "Draft " + sessionId + " foi alterado (versão " + current.getVersion() + ")");
        }
        return apply(current, session -> stateMachine.schedule(session, scheduledAt));
    }

    public DraftSession startSession(Long sessionId, String caller) {
        return apply(requireCommissioner(sessionId, caller), stateMachine::start);
    }

    public DraftSession pauseSession(Long sessionId, String caller) {
        return apply(requireCommissioner(sessionId, caller), stateMachine::pause);
    }

    public DraftSession resumeSession(Long sessionId, String caller) {
        return apply(requireCommissioner(sessionId, caller), stateMachine::resume);
    }

    /**
     * Inicia os drafts agendados cujo horário já passou.
     *
     * @return quantos drafts foram iniciados
     */
    public int startDueSessions() {
        Instant now = clock.instant();
        int started = 0;

        for (DraftSession session : store.findByStatus(DraftStatus.SCHEDULED)) {
            if (session.getScheduledAt() == null || session.getScheduledAt().isAfter(now)) {
                continue;
            }
            try {
                apply(session, stateMachine::start);
                started++;
            } catch (InvalidDraftTransitionException e) {
                log.debug("[DraftSession] Draft {} já iniciado por outra instância", session.getId());
            }
        }
        return started;
    }

    // ═══════════════════════════════════════════════════════════
    // CONSULTAS
    // ═══════════════════════════════════════════════════════════

    public DraftSession getSession(Long sessionId) {
        return store.find(sessionId).orElseThrow(() -> new DraftNotFoundException(sessionId));
    }

    public List<Selection> selections(Long sessionId) {
        getSession(sessionId);
        return store.selections(sessionId);
    }

    /**
     * Itens que o participante poderia escolher no turno atual, na ordem de
     * ranking. Vazio se o draft não está em andamento.
     */
    public Set<String> selectableItems(Long sessionId, String participantId) {
        DraftSession session = getSession(sessionId);
        if (!session.isInProgress() && session.getStatus() != DraftStatus.PAUSED) {
            return Set.of();
        }
        DraftConfiguration config = session.getConfiguration();
        String participant = participantId != null ? participantId : session.getCurrentPickerId();
        EligibilityContext context = new EligibilityContext(
                config,
                itemCatalog.snapshot(config.getPoolId()),
                store.selections(sessionId),
                participant,
                turnSequencer.roundOf(config, session.getCurrentOverallPick()));
        return EligibilityPolicies.forConfiguration(config).selectableItems(context);
    }

    public List<StandingEntry> standings(Long sessionId) {
        DraftSession session = getSession(sessionId);
        DraftConfiguration config = session.getConfiguration();
        CatalogSnapshot catalog = itemCatalog.snapshot(config.getPoolId());
        return standingsAggregator.compute(
                config.getOrder(),
                store.selections(sessionId),
                ScoringRules.of(config.getScoring(), catalog));
    }

    /**
     * DTO da sessão com os campos calculados na hora (timer, rodada e
     * categoria ativa).
     */
    public DraftSessionDTO toDTO(DraftSession session) {
        DraftSessionDTO dto = draftMapper.toDTO(session);
        DraftConfiguration config = session.getConfiguration();

        dto.setTimerState(turnTimer.state(session));
        turnTimer.remaining(session).ifPresent(dto::setRemainingSeconds);

        boolean hasTurn = session.getCurrentOverallPick() <= config.totalPicks()
                && (session.isInProgress() || session.getStatus() == DraftStatus.PAUSED);
        if (hasTurn) {
            int round = turnSequencer.roundOf(config, session.getCurrentOverallPick());
            dto.setCurrentRound(round);
            if (config.isRoundLocked()) {
                EligibilityContext context = new EligibilityContext(config,
                        itemCatalog.snapshot(config.getPoolId()), List.of(), session.getCurrentPickerId(), round);
                dto.setActiveCategory(new CategoryRoundsPolicy().activeCategory(context));
            }
        }
        return dto;
    }

    // ═══════════════════════════════════════════════════════════
    // AUXILIARES
    // ═══════════════════════════════════════════════════════════

    private DraftSession requireCommissioner(Long sessionId, String caller) {
        DraftSession session = getSession(sessionId);
        if (!session.isCommissioner(caller)) {
            throw new NotCommissionerException(sessionId, caller);
        }
        return session;
    }

    private DraftSession apply(DraftSession current, UnaryOperator<DraftSession> transition) {
        DraftSession next = transition.apply(current);
        if (!store.compareAndSet(next, current.getVersion(), null)) {
            log.warn("⚠️ [DraftSession] Transição {} → {} perdeu o CAS no draft {}",
                    current.getStatus(), next.getStatus(), current.getId());
            throw new InvalidDraftTransitionException(
                    "Draft " + current.getId() + " foi alterado por outra requisição");
        }
        log.info("✅ [DraftSession] Draft {}: {} → {} (versão {})",
                current.getId(), current.getStatus(), next.getStatus(), next.getVersion());
        broadcastService.publishStatusChanged(next);
        return next;
    }

    private DraftConfiguration buildConfiguration(CreateDraftRequest request, String commissionerId) {
        List<String> order = request.getParticipants() == null
                ? List.of()
                : new ArrayList<>(request.getParticipants());
        if (request.getOrderType() == DraftOrderType.RANDOM) {
            Collections.shuffle(order, random);
        }

        EligibilityMode mode = orDefault(request.getEligibilityMode(), EligibilityMode.OPEN_POOL);
        boolean shared = request.getSharedOwnership() != null
                ? request.getSharedOwnership()
                : mode == EligibilityMode.CATEGORY_CONSTRAINED;

        ScoringSettings defaults = ScoringSettings.defaults();
        ScoringSettings scoring = ScoringSettings.builder()
                .mode(orDefault(request.getScoringMode(), defaults.getMode()))
                .tiebreak(orDefault(request.getTiebreakMetric(), defaults.getTiebreak()))
                .pointsPerCorrectPick(orDefault(request.getPointsPerCorrectPick(), defaults.getPointsPerCorrectPick()))
                .direction(orDefault(request.getScoringDirection(), defaults.getDirection()))
                .build();

        return DraftConfiguration.builder()
                .leagueId(request.getLeagueId())
                .commissionerId(commissionerId)
                .poolId(request.getPoolId())
                .order(List.copyOf(order))
                .discipline(orDefault(request.getDiscipline(), DraftDiscipline.SERPENTINE))
                .roundsTotal(request.getRoundsTotal())
                .turnBudgetSeconds(orDefault(request.getTurnBudgetSeconds(),
                        draftProperties.getDefaultTurnBudgetSeconds()))
                .eligibilityMode(mode)
                .categoryStyle(orDefault(request.getCategoryStyle(), CategoryStyle.ANY_CATEGORY))
                .allowDuplicatePicks(Boolean.TRUE.equals(request.getAllowDuplicatePicks()))
                .sharedOwnership(shared)
                .fallbackPolicy(orDefault(request.getFallbackPolicy(), draftProperties.getDefaultFallbackPolicy()))
                .scoring(scoring)
                .build();
    }

    private void validateAgainstCatalog(DraftConfiguration config) {
        CatalogSnapshot catalog = itemCatalog.snapshot(config.getPoolId());
        if (catalog.itemsInPool().isEmpty()) {
            throw new InvalidDraftConfigurationException("Pool " + config.getPoolId() + " está vazio");
        }
        if (config.getEligibilityMode() == EligibilityMode.CATEGORY_CONSTRAINED && catalog.categories().isEmpty()) {
            throw new InvalidDraftConfigurationException(
                    "Pool " + config.getPoolId() + " não tem categorias para o modo por categoria");
        }
        if (config.getEligibilityMode() == EligibilityMode.OPEN_POOL && !config.isSharedOwnership()
                && catalog.itemsInPool().size() < config.totalPicks()) {
            throw new InvalidDraftConfigurationException(String.format(
                    "Pool %s tem %d itens, mas o draft precisa de %d picks",
                    config.getPoolId(), catalog.itemsInPool().size(), config.totalPicks()));
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
