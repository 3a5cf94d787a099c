package br.com.fantasyflicks.backend.domain.model;

/**
 * Disciplina de ordem do draft.
 */
public enum DraftDiscipline {

    /**
     * Mesma ordem em todas as rodadas
     */
    FIXED,

    /**
     * Snake draft: a ordem inverte nas rodadas pares (1-8, 8-1, 1-8...)
     */
    SERPENTINE
}
