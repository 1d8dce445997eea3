package com.pixshare.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record Event(
    EventId id,
    UserId ownerId,
    String title,
    String description,
    LocalDate date,
    LocalDateTime createdAt
) {}
