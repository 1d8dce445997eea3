package com.pixshare.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record PhotoId(@JsonValue long value) {

    public static PhotoId of(long value) {
        return new PhotoId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
