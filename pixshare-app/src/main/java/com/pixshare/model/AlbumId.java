package com.pixshare.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record AlbumId(@JsonValue long value) {

    public static AlbumId of(long value) {
        return new AlbumId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
