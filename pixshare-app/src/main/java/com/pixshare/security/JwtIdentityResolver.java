package com.pixshare.security;

import com.pixshare.config.SessionConfig;
import com.pixshare.model.UserId;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Session credentials are HS256-signed JWTs whose subject is the numeric user id.
 */
@Component
public class JwtIdentityResolver implements IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(JwtIdentityResolver.class);
    private static final int MIN_SECRET_BYTES = 32;
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey key;
    private final SessionConfig sessionConfig;
    private final Clock clock;

    public JwtIdentityResolver(SessionConfig sessionConfig, Clock clock) {
        String secret = sessionConfig.getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "pixshare.session.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.sessionConfig = sessionConfig;
        this.clock = clock;
    }

    @Override
    public Optional<UserId> resolve(String rawSession) {
        if (rawSession == null || rawSession.isBlank()) {
            return Optional.empty();
        }
        String token = rawSession.startsWith(BEARER_PREFIX)
            ? rawSession.substring(BEARER_PREFIX.length()).trim()
            : rawSession.trim();
        try {
            Claims claims = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
            return Optional.of(UserId.of(Long.parseLong(claims.getSubject())));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Issues a session token for the given user. Login itself happens elsewhere;
     * this is used by account tooling and tests.
     */
    public String issueToken(UserId userId) {
        Instant now = clock.instant();
        return Jwts.builder()
            .subject(Long.toString(userId.value()))
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(sessionConfig.getValidity())))
            .signWith(key)
            .compact();
    }
}
