package com.skillsarena.platform.exception;

public class InvalidSortKeyException extends InvalidRequestException {
    public InvalidSortKeyException(String message) {
        super(message, "INVALID_SORT_KEY");
    }
}
