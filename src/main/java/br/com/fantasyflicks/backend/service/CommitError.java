package br.com.fantasyflicks.backend.service;

/**
 * Motivos de recusa de um pick. Nenhum deles altera a sessão.
 */
public enum CommitError {

    SESSION_NOT_FOUND(false),

    /**
     * Sessão não está IN_PROGRESS (pendente, pausada ou concluída)
     */
    SESSION_NOT_ACTIVE(false),

    /**
     * A versão lida já não é a atual; recarregar e tentar uma vez
     */
    STALE_TURN(true),

    NOT_YOUR_TURN(false),

    NOT_ELIGIBLE(false),

    /**
     * Pedido de expiração antes do tempo do turno acabar
     */
    TIMER_NOT_EXPIRED(false);

    private final boolean retryable;

    CommitError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
