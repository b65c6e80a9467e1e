package com.listing.reconciliation.session;

/**
 * Building a comparison session failed. The session is left {@code FAILED} and none of its
 * changes are readable.
 */
public class SessionBuildException extends RuntimeException {

    private final String sessionId;

    public SessionBuildException(String sessionId, Throwable cause) {
        super("Session unavailable, retry extraction (session " + sessionId + "): " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
