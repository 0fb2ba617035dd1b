package com.skillsarena.platform.exception;

public class InvalidRequestException extends ArenaException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    protected InvalidRequestException(String message, String errorCode) {
        super(message, errorCode);
    }
}
