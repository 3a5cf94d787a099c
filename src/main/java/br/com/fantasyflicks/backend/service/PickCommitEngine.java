package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.service.catalog.ItemCatalog;
import br.com.fantasyflicks.backend.service.eligibility.EligibilityContext;
import br.com.fantasyflicks.backend.service.eligibility.EligibilityPolicies;
import br.com.fantasyflicks.backend.service.eligibility.EligibilityPolicy;
import br.com.fantasyflicks.backend.service.eligibility.IneligibilityReason;
import br.com.fantasyflicks.backend.service.store.DraftSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * ✅ Valida e grava picks
 * 
 * FLUXO:
 * 1. Carrega a sessão e confere status e versão esperada
 * 2. Confere se é a vez de quem propôs
 * 3. Confere elegibilidade do item no modo do draft
 * 4. Monta o pick e a sessão avançada e grava os dois num único
 * compare-and-swap sobre (sessionId, version)
 * 
 * Não há lock em memória: entre vários pedidos para a mesma versão, só o
 * primeiro CAS vence e os demais recebem STALE_TURN. Recusas voltam como
 * {@link CommitResult}, nunca como exceção, e não alteram nada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PickCommitEngine {

    private final DraftSessionStore store;
    private final TurnSequencer turnSequencer;
    private final DraftSessionStateMachine stateMachine;
    private final ItemCatalog itemCatalog;
    private final AutoPickSelector autoPickSelector;
    private final DraftEventBroadcastService broadcastService;
    private final Clock clock;

    /**
     * Pick feito por um participante.
     */
    public CommitResult commit(Long sessionId, String proposedBy, String itemId, long expectedVersion) {
        return process(sessionId, proposedBy, itemId, expectedVersion, false);
    }

    /**
     * Auto-pick do participante da vez, usando a política de fallback do draft.
     * Sem item elegível (ou com SKIP) grava um pick vazio e passa a vez.
     */
    public CommitResult autoSelect(Long sessionId, long expectedVersion) {
        return process(sessionId, null, null, expectedVersion, true);
    }

    private CommitResult process(Long sessionId, String proposedBy, String itemId,
            long expectedVersion, boolean autoSelected) {

        Optional<DraftSession> loaded = store.find(sessionId);
        if (loaded.isEmpty()) {
            log.warn("⚠️ [PickCommit] Sessão {} não encontrada", sessionId);
            return CommitResult.rejected(CommitError.SESSION_NOT_FOUND);
        }
        DraftSession session = loaded.get();

        if (!session.isInProgress()) {
            log.warn("⚠️ [PickCommit] Sessão {} não está em andamento (status={})", sessionId, session.getStatus());
            return CommitResult.rejected(CommitError.SESSION_NOT_ACTIVE);
        }

        if (session.getVersion() != expectedVersion) {
            log.warn("⚠️ [PickCommit] Versão desatualizada na sessão {}: esperada {}, atual {}",
                    sessionId, expectedVersion, session.getVersion());
            return CommitResult.rejected(CommitError.STALE_TURN);
        }

        DraftConfiguration config = session.getConfiguration();
        int overallPick = session.getCurrentOverallPick();
        String picker = turnSequencer.pickerFor(config, overallPick);

        if (!autoSelected && !picker.equals(proposedBy)) {
            log.warn("⚠️ [PickCommit] {} tentou escolher no pick {} da sessão {}, mas a vez é de {}",
                    proposedBy, overallPick, sessionId, picker);
            return CommitResult.rejected(CommitError.NOT_YOUR_TURN);
        }

        int round = turnSequencer.roundOf(config, overallPick);
        EligibilityContext context = new EligibilityContext(
                config,
                itemCatalog.snapshot(config.getPoolId()),
                store.selections(sessionId),
                picker,
                round);
        EligibilityPolicy policy = EligibilityPolicies.forConfiguration(config);

        String chosen;
        if (autoSelected) {
            chosen = autoPickSelector.choose(config.getFallbackPolicy(), policy.selectableItems(context))
                    .orElse(null);
        } else {
            Optional<IneligibilityReason> reason = policy.check(context, itemId);
            if (reason.isPresent()) {
                log.warn("⚠️ [PickCommit] Item {} recusado para {} na sessão {}: {}",
                        itemId, picker, sessionId, reason.get());
                return CommitResult.notEligible(reason.get());
            }
            chosen = itemId;
        }

        Selection selection = new Selection(
                sessionId,
                overallPick,
                round,
                turnSequencer.positionInRound(config, overallPick),
                picker,
                chosen,
                clock.instant(),
                autoSelected);
        DraftSession next = stateMachine.advance(session);

        if (!store.compareAndSet(next, expectedVersion, selection)) {
            log.warn("⚠️ [PickCommit] CAS perdido na sessão {} versão {} (pick {})",
                    sessionId, expectedVersion, overallPick);
            return CommitResult.rejected(CommitError.STALE_TURN);
        }

        if (autoSelected) {
            log.info("🤖 [PickCommit] Auto-pick na sessão {}: pick {} de {} → {}",
                    sessionId, overallPick, picker, chosen != null ? chosen : "(pulou)");
        } else {
            log.info("✅ [PickCommit] Pick {} da sessão {}: {} escolheu {}", overallPick, sessionId, picker, chosen);
        }

        broadcastService.publishPickCommitted(selection, next);
        if (next.isCompleted()) {
            log.info("🏁 [PickCommit] Draft {} concluído ({} picks)", sessionId, config.totalPicks());
            broadcastService.publishSessionCompleted(next);
        }

        return CommitResult.accepted(selection, next);
    }
}
