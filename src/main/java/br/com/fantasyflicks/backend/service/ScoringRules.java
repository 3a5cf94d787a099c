package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.ScoringSettings;
import br.com.fantasyflicks.backend.service.catalog.CatalogSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Configuração de pontuação mais os resultados conhecidos de cada item.
 */
@Value
@Builder
public class ScoringRules {

    @Builder.Default
    ScoringSettings settings = ScoringSettings.defaults();

    @Builder.Default
    Map<String, Double> itemValues = Map.of();

    /**
     * Itens que venceram (palpites corretos)
     */
    @Builder.Default
    Set<String> winners = Set.of();

    public static ScoringRules of(ScoringSettings settings, CatalogSnapshot catalog) {
        return ScoringRules.builder()
                .settings(settings)
                .itemValues(catalog.itemValues())
                .winners(catalog.winners())
                .build();
    }

    public double valueOf(String itemId) {
        return itemId == null ? 0.0 : itemValues.getOrDefault(itemId, 0.0);
    }

    public boolean isCorrect(String itemId) {
        return itemId != null && winners.contains(itemId);
    }
}
