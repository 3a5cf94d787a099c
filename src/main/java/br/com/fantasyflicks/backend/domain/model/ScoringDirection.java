package br.com.fantasyflicks.backend.domain.model;

public enum ScoringDirection {

    /**
     * Maior pontuação vence
     */
    HIGHEST,

    /**
     * Menor pontuação vence (ligas "sleeper")
     */
    LOWEST
}
