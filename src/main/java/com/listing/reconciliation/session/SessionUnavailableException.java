package com.listing.reconciliation.session;

import com.listing.reconciliation.core.model.SessionStatus;

/**
 * The session exists but did not complete, so its changes cannot be read or acted on.
 */
public class SessionUnavailableException extends RuntimeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionUnavailableException(String sessionId, SessionStatus status) {
        super("Session unavailable, retry extraction (session " + sessionId + " is " + status + ")");
        this.sessionId = sessionId;
        this.status = status;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
