package com.skillsarena.platform.exception;

public class ArenaException extends RuntimeException {
    private final String errorCode;

    public ArenaException(String message) {
        super(message);
        this.errorCode = "ARENA_ERROR";
    }

    public ArenaException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ArenaException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "ARENA_ERROR";
    }

    public ArenaException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
