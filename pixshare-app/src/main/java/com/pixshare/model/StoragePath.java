package com.pixshare.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Storage-relative location of an uploaded file: {@code photos/<owner_id>/<album_id>/<remainder>}.
 * <p>
 * {@link #parse(String)} only bounds the shape of the string. It performs no
 * lookups and says nothing about who may read the file.
 */
public record StoragePath(UserId ownerId, AlbumId albumId, String remainder) {

    public static final String PHOTO_CLASS = "photos";
    public static final String THUMBNAIL_DIR = "thumbs";

    private static final int MAX_LENGTH = 1024;
    private static final Pattern ID = Pattern.compile("[0-9]{1,18}");
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,199}");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    public static Optional<StoragePath> parse(String raw) {
        if (raw == null || raw.isEmpty() || raw.length() > MAX_LENGTH) {
            return Optional.empty();
        }
        String[] segments = raw.split("/", -1);
        if (segments.length < 4 || !PHOTO_CLASS.equals(segments[0])) {
            return Optional.empty();
        }
        if (!ID.matcher(segments[1]).matches() || !ID.matcher(segments[2]).matches()) {
            return Optional.empty();
        }
        String[] rest = Arrays.copyOfRange(segments, 3, segments.length);
        for (String segment : rest) {
            // rejects "", ".", "..", hidden names, backslashes and control characters
            if (!SEGMENT.matcher(segment).matches() || segment.contains("..")) {
                return Optional.empty();
            }
        }
        return Optional.of(new StoragePath(
            UserId.of(Long.parseLong(segments[1])),
            AlbumId.of(Long.parseLong(segments[2])),
            String.join("/", rest)
        ));
    }

    public static StoragePath of(UserId ownerId, AlbumId albumId, String filename) {
        return new StoragePath(ownerId, albumId, safeFilename(filename));
    }

    /**
     * Reduces an uploaded file name to characters {@link #parse(String)} accepts.
     */
    public static String safeFilename(String original) {
        if (original == null) {
            throw new IllegalArgumentException("File name is required");
        }
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = UNSAFE_CHARS.matcher(name).replaceAll("_").replace("..", "_");
        if (name.length() > 200) {
            name = name.substring(name.length() - 200);
        }
        while (!name.isEmpty() && !Character.isLetterOrDigit(name.charAt(0))) {
            name = name.substring(1);
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("File name has no usable characters: " + original);
        }
        return name;
    }

    public StoragePath thumbnail() {
        String file = remainder.substring(remainder.lastIndexOf('/') + 1);
        return new StoragePath(ownerId, albumId, THUMBNAIL_DIR + "/" + file);
    }

    @Override
    public String toString() {
        return PHOTO_CLASS + "/" + ownerId.value() + "/" + albumId.value() + "/" + remainder;
    }
}
