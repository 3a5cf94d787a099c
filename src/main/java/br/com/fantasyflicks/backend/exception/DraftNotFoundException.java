package br.com.fantasyflicks.backend.exception;

public class DraftNotFoundException extends RuntimeException {

    private final Long sessionId;

    public DraftNotFoundException(Long sessionId) {
        super("Draft não encontrado: " + sessionId);
        this.sessionId = sessionId;
    }

    public Long getSessionId() {
        return sessionId;
    }
}
