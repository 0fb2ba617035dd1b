package com.skillsarena.platform.exception;

public class VersionConflictException extends PolicyViolationException {
    private final String conflictingSkillId;

    public VersionConflictException(String name, String version, String conflictingSkillId) {
        super("A different skill named '" + name + "' already exists at version " + version
            + "; bump the version", "VERSION_CONFLICT");
        this.conflictingSkillId = conflictingSkillId;
    }

    public String getConflictingSkillId() {
        return conflictingSkillId;
    }
}
