package com.skillsarena.platform.exception;

public class DuplicateReviewException extends PolicyViolationException {
    public DuplicateReviewException(String skillId) {
        super("This agent has already reviewed skill " + skillId, "DUPLICATE_REVIEW");
    }
}
