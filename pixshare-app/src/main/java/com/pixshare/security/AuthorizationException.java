package com.pixshare.security;

/**
 * Thrown by services when the engine denies an operation. Carries the verdict
 * so the web layer can pick the status code.
 */
public class AuthorizationException extends RuntimeException {

    private final Verdict verdict;

    public AuthorizationException(Verdict verdict) {
        super(verdict.reason());
        this.verdict = verdict;
    }

    public Verdict verdict() {
        return verdict;
    }
}
