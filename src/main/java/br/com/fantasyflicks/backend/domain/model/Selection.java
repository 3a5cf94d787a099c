package br.com.fantasyflicks.backend.domain.model;

import java.time.Instant;

/**
 * Pick confirmado (append-only). {@code itemId} só é null num auto-pick SKIP.
 */
public record Selection(
        Long sessionId,
        int overallPickNumber,
        int roundNumber,
        int positionInRound,
        String pickerId,
        String itemId,
        Instant committedAt,
        boolean autoSelected) {

    public boolean isSkip() {
        return itemId == null;
    }
}
