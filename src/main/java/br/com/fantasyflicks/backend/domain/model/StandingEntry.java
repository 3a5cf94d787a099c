package br.com.fantasyflicks.backend.domain.model;

/**
 * Linha da classificação (projeção, nunca persistida).
 */
public record StandingEntry(
        String participantId,
        int rank,
        double primaryScore,
        double secondaryTiebreakMetric,
        int selectionCount) {
}
