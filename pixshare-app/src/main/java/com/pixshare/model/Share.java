package com.pixshare.model;

import java.time.LocalDateTime;

/**
 * Capability token bound to one album, photo or event.
 * A share whose scope is null never authorizes anything.
 */
public record Share(
    Long id,
    String token,
    ResourceRef scope,
    Capabilities capabilities,
    LocalDateTime expiresAt,
    Long maxUploadBytes,
    Integer maxFilesPerGuest,
    LocalDateTime createdAt
) {
    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsableAt(LocalDateTime now) {
        return scope != null && !isExpiredAt(now);
    }
}
