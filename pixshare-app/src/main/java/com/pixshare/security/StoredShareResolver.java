package com.pixshare.security;

import com.pixshare.model.Share;
import com.pixshare.repository.ShareRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves share tokens from the {@code shares} table. Strings that cannot be
 * a token are turned away before they reach the database.
 */
@Component
public class StoredShareResolver implements ShareResolver {

    private static final Pattern TOKEN_SHAPE = Pattern.compile("[A-Za-z0-9_-]{8,128}");

    private final ShareRepository shareRepository;

    public StoredShareResolver(ShareRepository shareRepository) {
        this.shareRepository = shareRepository;
    }

    public static boolean isWellFormed(String token) {
        return token != null && TOKEN_SHAPE.matcher(token).matches();
    }

    @Override
    public Optional<Share> resolve(String token) {
        if (!isWellFormed(token)) {
            return Optional.empty();
        }
        return shareRepository.findByToken(token);
    }
}
