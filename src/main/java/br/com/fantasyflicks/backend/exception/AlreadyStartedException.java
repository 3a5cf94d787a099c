package br.com.fantasyflicks.backend.exception;

import br.com.fantasyflicks.backend.domain.model.DraftStatus;

/**
 * Tentativa de iniciar um draft que não está PENDING nem SCHEDULED.
 */
public class AlreadyStartedException extends RuntimeException {

    private final DraftStatus status;

    public AlreadyStartedException(Long sessionId, DraftStatus status) {
        super("Draft " + sessionId + " já foi iniciado (status=" + status + ")");
        this.status = status;
    }

    public DraftStatus getStatus() {
        return status;
    }
}
