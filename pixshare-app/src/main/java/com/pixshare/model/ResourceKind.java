package com.pixshare.model;

public enum ResourceKind {
    ALBUM,
    PHOTO,
    EVENT
}
