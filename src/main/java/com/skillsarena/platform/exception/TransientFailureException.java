package com.skillsarena.platform.exception;

public class TransientFailureException extends ArenaException {
    public TransientFailureException(String message, Throwable cause) {
        super(message, "TRANSIENT_FAILURE", cause);
    }
}
