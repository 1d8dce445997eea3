package com.pixshare.model;

import java.time.LocalDateTime;

public record Comment(
    Long id,
    PhotoId photoId,
    String content,
    UserId userId,
    Long guestId,
    Long shareId,
    String author,
    LocalDateTime createdAt
) {}
