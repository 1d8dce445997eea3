package com.pixshare.model;

import java.time.LocalDateTime;

public record Guest(
    Long id,
    Long shareId,
    String guestKey,
    String displayName,
    LocalDateTime createdAt,
    LocalDateTime lastSeenAt
) {}
