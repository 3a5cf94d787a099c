package br.com.fantasyflicks.backend.exception;

public class InvalidDraftTransitionException extends RuntimeException {

    public InvalidDraftTransitionException(String message) {
        super(message);
    }
}
