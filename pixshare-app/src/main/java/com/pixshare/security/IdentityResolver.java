package com.pixshare.security;

import com.pixshare.model.UserId;

import java.util.Optional;

/**
 * Verifies session credentials. Absent and invalid credentials both come back
 * empty; callers cannot tell them apart.
 */
public interface IdentityResolver {

    Optional<UserId> resolve(String rawSession);
}
