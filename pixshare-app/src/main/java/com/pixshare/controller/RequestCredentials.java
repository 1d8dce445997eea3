package com.pixshare.controller;

import com.pixshare.security.Credentials;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Pulls credentials off an incoming request: the session token from the
 * {@code Authorization} header, the share token from {@code X-Share-Token} or
 * the {@code t} query parameter.
 */
final class RequestCredentials {

    static final String SHARE_HEADER = "X-Share-Token";
    static final String GUEST_HEADER = "X-Guest-Key";

    private RequestCredentials() {
    }

    static Credentials from(HttpServletRequest request) {
        String share = request.getHeader(SHARE_HEADER);
        if (share == null || share.isBlank()) {
            share = request.getParameter("t");
        }
        return new Credentials(request.getHeader("Authorization"), share);
    }

    /**
     * For {@code /api/s/{token}/...} routes, where the share token is part of the path.
     */
    static Credentials withShare(HttpServletRequest request, String shareToken) {
        return new Credentials(request.getHeader("Authorization"), shareToken);
    }

    static String guestKey(HttpServletRequest request) {
        return request.getHeader(GUEST_HEADER);
    }
}
