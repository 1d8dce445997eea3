package com.pixshare.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a registered account. Compared by value, never by display string.
 */
public record UserId(@JsonValue long value) {

    public static UserId of(long value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
