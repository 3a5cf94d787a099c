package br.com.fantasyflicks.backend.domain.model;

public enum ScoringMode {

    /**
     * Soma do valor de cada item (ex.: bilheteria do filme)
     */
    ITEM_VALUE_SUM,

    /**
     * Palpites corretos × pontos por acerto
     */
    CORRECT_PREDICTIONS
}
