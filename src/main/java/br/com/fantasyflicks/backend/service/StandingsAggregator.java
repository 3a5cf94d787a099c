package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.ScoringDirection;
import br.com.fantasyflicks.backend.domain.model.ScoringSettings;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.domain.model.StandingEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 🏆 Classificação a partir dos picks confirmados.
 * 
 * Ordenação:
 * 1. Pontuação principal (maior primeiro, ou menor com direção LOWEST)
 * 2. Métrica de desempate configurada (sempre maior primeiro)
 * 3. Posição na ordem do draft
 * 4. ID do participante
 * 
 * Rank = posição + 1, sem empates.
 */
@Component
public class StandingsAggregator {

    /**
     * Classificação só com quem tem picks, na ordem em que apareceram.
     */
    public List<StandingEntry> compute(List<Selection> selections, ScoringRules rules) {
        List<String> participants = new ArrayList<>();
        for (Selection selection : selections) {
            if (!participants.contains(selection.pickerId())) {
                participants.add(selection.pickerId());
            }
        }
        return compute(participants, selections, rules);
    }

    /**
     * Classificação incluindo participantes sem picks (pontuação zero).
     *
     * @param participants ordem do draft, usada no desempate final
     */
    public List<StandingEntry> compute(List<String> participants, List<Selection> selections, ScoringRules rules) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (int i = 0; i < participants.size(); i++) {
            tallies.put(participants.get(i), new Tally(participants.get(i), i));
        }

        for (Selection selection : selections) {
            Tally tally = tallies.computeIfAbsent(selection.pickerId(), id -> new Tally(id, Integer.MAX_VALUE));
            if (selection.isSkip()) {
                continue;
            }
            tally.count++;
            tally.valueSum += rules.valueOf(selection.itemId());
            if (rules.isCorrect(selection.itemId())) {
                tally.correct++;
            }
        }

        ScoringSettings settings = rules.getSettings();
        List<Tally> ordered = new ArrayList<>(tallies.values());
        for (Tally tally : ordered) {
            tally.primary = primaryScore(tally, settings);
            tally.secondary = secondaryMetric(tally, settings);
        }

        Comparator<Tally> byPrimary = Comparator.comparingDouble(t -> t.primary);
        if (settings.getDirection() == ScoringDirection.HIGHEST) {
            byPrimary = byPrimary.reversed();
        }
        ordered.sort(byPrimary
                .thenComparing(Comparator.<Tally>comparingDouble(t -> t.secondary).reversed())
                .thenComparingInt(t -> t.orderIndex)
                .thenComparing(t -> t.participantId));

        List<StandingEntry> standings = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Tally tally = ordered.get(i);
            standings.add(new StandingEntry(tally.participantId, i + 1, tally.primary, tally.secondary, tally.count));
        }
        return standings;
    }

    private double primaryScore(Tally tally, ScoringSettings settings) {
        switch (settings.getMode()) {
            case CORRECT_PREDICTIONS:
                return tally.correct * settings.getPointsPerCorrectPick();
            case ITEM_VALUE_SUM:
            default:
                return tally.valueSum;
        }
    }

    private double secondaryMetric(Tally tally, ScoringSettings settings) {
        switch (settings.getTiebreak()) {
            case CORRECT_COUNT:
                return tally.correct;
            case ITEM_COUNT:
            default:
                return tally.count;
        }
    }

    private static final class Tally {
        private final String participantId;
        private final int orderIndex;
        private int count;
        private int correct;
        private double valueSum;
        private double primary;
        private double secondary;

        private Tally(String participantId, int orderIndex) {
            this.participantId = participantId;
            this.orderIndex = orderIndex;
        }
    }
}
