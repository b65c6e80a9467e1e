package com.listing.reconciliation.rest.dto;

/**
 * Machine-readable reason carried by an {@link ErrorResponse}, with the HTTP status it maps to.
 */
public enum ErrorCode {
    INVALID_REQUEST(400, "Bad Request"),
    SESSION_NOT_FOUND(404, "Not Found"),
    CHANGE_NOT_FOUND(404, "Not Found"),
    /** The review state machine forbids the requested status. */
    INVALID_TRANSITION(409, "Conflict"),
    /** The session is still processing or failed; retry the extraction. */
    SESSION_UNAVAILABLE(409, "Conflict"),
    SESSION_BUILD_FAILED(500, "Internal Server Error"),
    INTERNAL_ERROR(500, "Internal Server Error");

    private final int status;
    private final String reason;

    ErrorCode(int status, String reason) {
        this.status = status;
        this.reason = reason;
    }

    public int status() {
        return status;
    }

    public String reason() {
        return reason;
    }
}
