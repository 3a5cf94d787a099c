package br.com.fantasyflicks.backend.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Regras de pontuação configuradas na criação do draft.
 * Os valores por item e os vencedores vêm do catálogo.
 */
@Value
@Builder(toBuilder = true)
public class ScoringSettings {

    @Builder.Default
    ScoringMode mode = ScoringMode.ITEM_VALUE_SUM;

    @Builder.Default
    TiebreakMetric tiebreak = TiebreakMetric.ITEM_COUNT;

    @Builder.Default
    double pointsPerCorrectPick = 1.0;

    @Builder.Default
    ScoringDirection direction = ScoringDirection.HIGHEST;

    public static ScoringSettings defaults() {
        return ScoringSettings.builder().build();
    }
}
