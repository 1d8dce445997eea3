package com.pixshare.security;

import com.pixshare.model.Share;

import java.util.Optional;

/**
 * Looks up a share by token. Expired shares are still returned; it is up to
 * the caller to treat them as unusable.
 */
public interface ShareResolver {

    Optional<Share> resolve(String token);
}
