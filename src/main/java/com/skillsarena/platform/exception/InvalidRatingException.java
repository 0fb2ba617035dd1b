package com.skillsarena.platform.exception;

public class InvalidRatingException extends InvalidRequestException {
    public InvalidRatingException(String message) {
        super(message, "INVALID_RATING");
    }
}
