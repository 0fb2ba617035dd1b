package com.skillsarena.platform.exception;

public class InvalidActionException extends InvalidRequestException {
    public InvalidActionException(String message) {
        super(message, "INVALID_ACTION");
    }
}
