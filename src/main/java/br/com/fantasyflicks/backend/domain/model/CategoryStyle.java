package br.com.fantasyflicks.backend.domain.model;

/**
 * Estilo do draft por categoria (só vale para CATEGORY_CONSTRAINED).
 */
public enum CategoryStyle {

    /**
     * Participante escolhe em qualquer categoria ainda não preenchida
     */
    ANY_CATEGORY,

    /**
     * Cada rodada libera uma única categoria, na ordem do catálogo
     */
    CATEGORY_ROUNDS
}
