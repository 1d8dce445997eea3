package com.pixshare.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record EventId(@JsonValue long value) {

    public static EventId of(long value) {
        return new EventId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
