package com.pixshare.model;

/**
 * Points at one album, photo or event. Used both as the target of an access
 * check and as the scope a share is bound to.
 */
public record ResourceRef(ResourceKind kind, long id) {

    public ResourceRef {
        if (kind == null) {
            throw new IllegalArgumentException("Resource kind is required");
        }
    }

    public static ResourceRef album(long id) {
        return new ResourceRef(ResourceKind.ALBUM, id);
    }

    public static ResourceRef photo(long id) {
        return new ResourceRef(ResourceKind.PHOTO, id);
    }

    public static ResourceRef event(long id) {
        return new ResourceRef(ResourceKind.EVENT, id);
    }

    public AlbumId albumId() {
        requireKind(ResourceKind.ALBUM);
        return AlbumId.of(id);
    }

    public PhotoId photoId() {
        requireKind(ResourceKind.PHOTO);
        return PhotoId.of(id);
    }

    public EventId eventId() {
        requireKind(ResourceKind.EVENT);
        return EventId.of(id);
    }

    private void requireKind(ResourceKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " reference but was " + this);
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
