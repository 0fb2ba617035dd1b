package com.skillsarena.platform.model;

import com.skillsarena.platform.exception.InvalidTargetTypeException;

public enum TargetType {
    SKILL("skill"),
    COMMENT("comment");

    private final String value;

    TargetType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TargetType fromValue(String value) {
        if (value != null) {
            for (TargetType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidTargetTypeException(
            "Invalid target type: " + value + ". Must be 'skill' or 'comment'");
    }
}
