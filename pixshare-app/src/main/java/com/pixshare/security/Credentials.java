package com.pixshare.security;

/**
 * Raw credentials presented with a request. Either part may be absent; blank
 * values count as absent.
 */
public record Credentials(String session, String shareToken) {

    private static final Credentials NONE = new Credentials(null, null);

    public Credentials {
        session = blankToNull(session);
        shareToken = blankToNull(shareToken);
    }

    public static Credentials none() {
        return NONE;
    }

    public static Credentials ofSession(String session) {
        return new Credentials(session, null);
    }

    public static Credentials ofShare(String shareToken) {
        return new Credentials(null, shareToken);
    }

    public boolean hasSession() {
        return session != null;
    }

    public boolean hasShareToken() {
        return shareToken != null;
    }

    public boolean isEmpty() {
        return session == null && shareToken == null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        // never print the secrets themselves
        return "Credentials[session=" + (hasSession() ? "present" : "absent")
            + ", shareToken=" + (hasShareToken() ? "present" : "absent") + "]";
    }
}
