package br.com.fantasyflicks.backend.domain.model;

/**
 * Política de auto-pick quando o timer do turno expira.
 */
public enum FallbackPolicy {

    /**
     * Primeiro item elegível pela ordem de ranking do catálogo
     */
    HIGHEST_RANKED,

    /**
     * Item elegível aleatório
     */
    RANDOM,

    /**
     * Registra um pick vazio e passa a vez
     */
    SKIP
}
