package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * ⏰ Timer do turno calculado a partir do relógio do servidor.
 * 
 * Não existe thread contando o tempo: o restante é sempre
 * {@code budget - (agora - turnStartedAt)}, em segundos inteiros.
 */
@Component
@RequiredArgsConstructor
public class TurnTimer {

    private final Clock clock;

    /**
     * Segundos restantes do turno atual, ou vazio quando o timer está IDLE.
     */
    public OptionalLong remaining(DraftSession session) {
        if (!hasActiveTurn(session)) {
            return OptionalLong.empty();
        }
        long budget = session.getConfiguration().getTurnBudgetSeconds();
        long elapsed = Math.max(0, Duration.between(session.getTurnStartedAt(), clock.instant()).getSeconds());
        return OptionalLong.of(Math.max(0, budget - elapsed));
    }

    public TimerState state(DraftSession session) {
        OptionalLong remaining = remaining(session);
        if (remaining.isEmpty()) {
            return TimerState.IDLE;
        }
        return remaining.getAsLong() == 0 ? TimerState.EXPIRED : TimerState.RUNNING;
    }

    public boolean isExpired(DraftSession session) {
        return state(session) == TimerState.EXPIRED;
    }

    private boolean hasActiveTurn(DraftSession session) {
        return session.isInProgress()
                && session.getConfiguration().isTimed()
                && session.getTurnStartedAt() != null;
    }
}
