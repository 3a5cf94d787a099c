package br.com.fantasyflicks.backend.exception;

public class InvalidDraftConfigurationException extends IllegalArgumentException {

    public InvalidDraftConfigurationException(String message) {
        super(message);
    }
}
