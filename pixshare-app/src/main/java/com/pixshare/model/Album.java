package com.pixshare.model;

import java.time.LocalDateTime;

public record Album(
    AlbumId id,
    String title,
    String description,
    UserId ownerId,
    LocalDateTime createdAt,
    int photoCount
) {}
