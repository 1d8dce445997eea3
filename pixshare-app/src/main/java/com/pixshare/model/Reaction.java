package com.pixshare.model;

public record Reaction(
    PhotoId photoId,
    String emoji,
    int count
) {}
