package br.com.fantasyflicks.backend.domain.model;

/**
 * ✅ Estados possíveis de uma sessão de draft
 * 
 * PENDING → SCHEDULED → IN_PROGRESS ⇄ PAUSED → COMPLETED
 */
public enum DraftStatus {

    /**
     * Draft criado, ainda sem horário
     */
    PENDING,

    /**
     * Horário de início definido
     */
    SCHEDULED,

    /**
     * Draft acontecendo, aceita picks
     */
    IN_PROGRESS,

    /**
     * Draft pausado pelo comissário
     */
    PAUSED,

    /**
     * Todos os picks foram feitos
     */
    COMPLETED;

    /**
     * Verifica se o draft ainda pode ser iniciado
     */
    public boolean canStart() {
        return this == PENDING || this == SCHEDULED;
    }
}
