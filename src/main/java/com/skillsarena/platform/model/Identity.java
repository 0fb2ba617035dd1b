package com.skillsarena.platform.model;

import lombok.Value;

/**
 * Resolved caller. The core only compares and stores {@code agentId}.
 */
@Value
public class Identity {
    String agentId;
    String did;
}
