package com.pixshare.model;

import java.time.LocalDateTime;

/**
 * Standing membership of a user in an event. The capabilities are those of the
 * share the user joined with, frozen at join time.
 */
public record Participant(
    Long id,
    EventId eventId,
    UserId userId,
    String shareToken,
    Capabilities capabilities,
    LocalDateTime joinedAt
) {}
