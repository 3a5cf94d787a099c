package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.service.lock.DraftTimerLockService;
import br.com.fantasyflicks.backend.service.store.DraftSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * ⏰ Expiração de turnos
 * 
 * Um turno expirado vira auto-pick uma única vez: o auto-pick usa a versão
 * observada como versão esperada, então uma segunda observação do mesmo
 * turno perde o CAS e não faz nada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnExpiryService {

    private final DraftSessionStore store;
    private final TurnTimer turnTimer;
    private final PickCommitEngine pickCommitEngine;
    private final DraftTimerLockService timerLockService;

    /**
     * Expira o turno da versão informada, se o tempo realmente acabou.
     */
    public CommitResult expireTurn(Long sessionId, long expectedVersion) {
        Optional<DraftSession> loaded = store.find(sessionId);
        if (loaded.isEmpty()) {
            return CommitResult.rejected(CommitError.SESSION_NOT_FOUND);
        }
        DraftSession session = loaded.get();

        if (!session.isInProgress()) {
            return CommitResult.rejected(CommitError.SESSION_NOT_ACTIVE);
        }
        if (session.getVersion() != expectedVersion) {
            log.debug("[TurnExpiry] Turno da sessão {} versão {} já avançou", sessionId, expectedVersion);
            return CommitResult.rejected(CommitError.STALE_TURN);
        }
        if (!turnTimer.isExpired(session)) {
            log.warn("⚠️ [TurnExpiry] Expiração pedida antes do tempo na sessão {} (restam {}s)",
                    sessionId, turnTimer.remaining(session).orElse(0));
            return CommitResult.rejected(CommitError.TIMER_NOT_EXPIRED);
        }
        if (!timerLockService.claimExpiry(sessionId, expectedVersion)) {
            return CommitResult.rejected(CommitError.STALE_TURN);
        }

        log.info("⏰ [TurnExpiry] Tempo esgotado para {} no pick {} da sessão {}",
                session.getCurrentPickerId(), session.getCurrentOverallPick(), sessionId);
        CommitResult result = pickCommitEngine.autoSelect(sessionId, expectedVersion);
        if (!result.success()) {
            // libera o claim para outra instância tentar de novo
            timerLockService.releaseExpiry(sessionId, expectedVersion);
        }
        return result;
    }

    /**
     * Varre as sessões em andamento e expira os turnos vencidos.
     *
     * @return quantos auto-picks foram gravados
     */
    public int expireOverdueTurns() {
        int expired = 0;
        for (DraftSession session : store.findByStatus(DraftStatus.IN_PROGRESS)) {
            if (!turnTimer.isExpired(session)) {
                continue;
            }
            CommitResult result = expireTurn(session.getId(), session.getVersion());
            if (result.success()) {
                expired++;
            }
        }
        return expired;
    }
}
