package br.com.fantasyflicks.backend.exception;

public class NotCommissionerException extends RuntimeException {

    public NotCommissionerException(Long sessionId, String participantId) {
        super("Participante " + participantId + " não é o comissário do draft " + sessionId);
    }
}
