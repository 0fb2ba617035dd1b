package com.skillsarena.platform.exception;

/**
 * A well-formed request that the reputation rules refuse.
 */
public class PolicyViolationException extends ArenaException {
    public PolicyViolationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
