package com.skillsarena.platform.exception;

public class InvalidTargetTypeException extends InvalidRequestException {
    public InvalidTargetTypeException(String message) {
        super(message, "INVALID_TARGET_TYPE");
    }
}
