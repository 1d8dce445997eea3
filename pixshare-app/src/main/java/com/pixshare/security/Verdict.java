package com.pixshare.security;

import com.pixshare.model.Capabilities;
import com.pixshare.model.Share;
import com.pixshare.model.UserId;
import org.springframework.http.HttpStatus;

/**
 * Outcome of one access check. A granted verdict names the basis it was
 * granted on and carries the caller's identity and share when they were used,
 * so services can attribute the action to a user, a share, or both.
 * <p>
 * A {@code FORBIDDEN} verdict carries a basis only when it was decided from the
 * caller's own share or event membership, so reporting it discloses nothing
 * about the target.
 */
public record Verdict(
    Status status,
    Basis basis,
    Capabilities capabilities,
    UserId userId,
    Share share,
    String reason
) {

    public enum Status {
        GRANTED(HttpStatus.OK),
        AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED),
        FORBIDDEN(HttpStatus.FORBIDDEN),
        NOT_FOUND(HttpStatus.NOT_FOUND),
        INVALID_SHARE(HttpStatus.NOT_FOUND);

        private final HttpStatus httpStatus;

        Status(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus httpStatus() {
            return httpStatus;
        }
    }

    public enum Basis {
        OWNER,
        PARTICIPANT,
        SHARE
    }

    public static Verdict granted(Basis basis, Capabilities capabilities, UserId userId, Share share) {
        return new Verdict(Status.GRANTED, basis, capabilities, userId, share, null);
    }

    public static Verdict authenticationRequired() {
        return denied(Status.AUTHENTICATION_REQUIRED, "Sign in or open a share link to continue");
    }

    public static Verdict forbidden(String reason) {
        return denied(Status.FORBIDDEN, reason);
    }

    /**
     * Refusal decided from the caller's own share or membership.
     */
    public static Verdict forbidden(Basis claim, String reason) {
        return new Verdict(Status.FORBIDDEN, claim, Capabilities.NONE, null, null, reason);
    }

    public static Verdict notFound() {
        return denied(Status.NOT_FOUND, "Not found");
    }

    public static Verdict invalidShare() {
        return denied(Status.INVALID_SHARE, "Invalid or expired link");
    }

    private static Verdict denied(Status status, String reason) {
        return new Verdict(status, null, Capabilities.NONE, null, null, reason);
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }

    /**
     * Same verdict, except a {@code FORBIDDEN} becomes {@code NOT_FOUND}. For
     * endpoints that must not confirm a resource exists to a caller with no
     * claim on it.
     */
    public Verdict concealed() {
        return status == Status.FORBIDDEN ? notFound() : this;
    }

    /**
     * Like {@link #concealed()}, but keeps a {@code FORBIDDEN} that rests on the
     * caller's own share or membership.
     */
    public Verdict concealedUnlessClaimed() {
        return status == Status.FORBIDDEN && basis == null ? notFound() : this;
    }

    public HttpStatus httpStatus() {
        return status.httpStatus();
    }
}
