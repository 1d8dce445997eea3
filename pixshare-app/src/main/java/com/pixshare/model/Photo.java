package com.pixshare.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record Photo(
    PhotoId id,
    AlbumId albumId,
    UserId ownerId,
    String filename,
    String storagePath,     // relative to the storage root: photos/<user_id>/<album_id>/<file>
    long size,
    LocalDateTime uploadedAt,
    Long uploadedViaShareId,
    Long uploadedByGuestId
) {
    @JsonProperty
    public String thumbnailPath() {
        return StoragePath.parse(storagePath)
            .map(StoragePath::thumbnail)
            .map(StoragePath::toString)
            .orElse(null);
    }
}
