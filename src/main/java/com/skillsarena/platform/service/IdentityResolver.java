package com.skillsarena.platform.service;

import com.skillsarena.platform.model.Identity;

import java.util.Optional;

/**
 * Maps the opaque caller token (an agent DID) to a registered identity.
 */
public interface IdentityResolver {
    Optional<Identity> resolve(String token);
}
