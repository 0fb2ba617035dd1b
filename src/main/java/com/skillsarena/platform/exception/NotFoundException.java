package com.skillsarena.platform.exception;

public class NotFoundException extends ArenaException {
    public NotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }

    public static NotFoundException skill(String skillId) {
        return new NotFoundException("Skill not found: " + skillId, "SKILL_NOT_FOUND");
    }

    public static NotFoundException comment(String commentId) {
        return new NotFoundException("Comment not found: " + commentId, "COMMENT_NOT_FOUND");
    }

    public static NotFoundException identity() {
        return new NotFoundException("Agent not found for the supplied DID", "IDENTITY_NOT_FOUND");
    }
}
