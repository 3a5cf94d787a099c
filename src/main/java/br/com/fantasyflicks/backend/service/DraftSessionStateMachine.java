package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.exception.AlreadyStartedException;
import br.com.fantasyflicks.backend.exception.InvalidDraftTransitionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Transições de ciclo de vida da sessão.
 * 
 * Cada método recebe o snapshot atual e devolve o próximo, com
 * {@code version + 1}. Nada é gravado aqui: quem chama aplica o resultado no
 * store com compare-and-swap.
 */
@Component
@RequiredArgsConstructor
public class DraftSessionStateMachine {

    private final TurnSequencer turnSequencer;
    private final Clock clock;

    public DraftSession schedule(DraftSession session, Instant scheduledAt) {
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt é obrigatório");
        }
        if (!session.getStatus().canStart()) {
            throw new InvalidDraftTransitionException(
                    "Draft " + session.getId() + " não pode ser agendado no status " + session.getStatus());
        }
        return session.toBuilder()
                .status(DraftStatus.SCHEDULED)
                .scheduledAt(scheduledAt)
                .version(session.getVersion() + 1)
                .build();
    }

    /**
     * Inicia o draft no pick 1.
     *
     * @throws AlreadyStartedException se o draft não está PENDING nem SCHEDULED
     */
    public DraftSession start(DraftSession session) {
        if (!session.getStatus().canStart()) {
            throw new AlreadyStartedException(session.getId(), session.getStatus());
        }
        Instant now = clock.instant();
        DraftConfiguration config = session.getConfiguration();
        return session.toBuilder()
                .status(DraftStatus.IN_PROGRESS)
                .currentOverallPick(1)
                .currentPickerId(turnSequencer.pickerFor(config, 1))
                .turnStartedAt(config.isTimed() ? now : null)
                .startedAt(now)
                .version(session.getVersion() + 1)
                .build();
    }

    public DraftSession pause(DraftSession session) {
        if (session.getStatus() != DraftStatus.IN_PROGRESS) {
            throw new InvalidDraftTransitionException(
                    "Draft " + session.getId() + " só pode ser pausado em andamento (status=" + session.getStatus() + ")");
        }
        return session.toBuilder()
                .status(DraftStatus.PAUSED)
                .pausedAt(clock.instant())
                .version(session.getVersion() + 1)
                .build();
    }

    /**
     * Retoma o draft. O início do turno é empurrado pelo tempo pausado, então
     * o participante da vez mantém o tempo que ainda tinha.
     */
    public DraftSession resume(DraftSession session) {
        if (session.getStatus() != DraftStatus.PAUSED) {
            throw new InvalidDraftTransitionException(
                    "Draft " + session.getId() + " não está pausado (status=" + session.getStatus() + ")");
        }
        Instant now = clock.instant();
        Instant turnStartedAt = session.getTurnStartedAt();
        if (turnStartedAt != null && session.getPausedAt() != null) {
            Duration paused = Duration.between(session.getPausedAt(), now);
            if (!paused.isNegative()) {
                turnStartedAt = turnStartedAt.plus(paused);
            }
        }
        return session.toBuilder()
                .status(DraftStatus.IN_PROGRESS)
                .turnStartedAt(turnStartedAt)
                .pausedAt(null)
                .version(session.getVersion() + 1)
                .build();
    }

    /**
     * Avança para o próximo pick depois de um pick aceito. No último pick a
     * sessão vai para COMPLETED sem participante da vez.
     */
    public DraftSession advance(DraftSession session) {
        DraftConfiguration config = session.getConfiguration();
        int next = session.getCurrentOverallPick() + 1;
        Instant now = clock.instant();

        if (next > config.totalPicks()) {
            return session.toBuilder()
                    .status(DraftStatus.COMPLETED)
                    .currentOverallPick(next)
                    .currentPickerId(null)
                    .turnStartedAt(null)
                    .completedAt(now)
                    .version(session.getVersion() + 1)
                    .build();
        }

        return session.toBuilder()
                .currentOverallPick(next)
                .currentPickerId(turnSequencer.pickerFor(config, next))
                .turnStartedAt(config.isTimed() ? now : null)
                .version(session.getVersion() + 1)
                .build();
    }
}
