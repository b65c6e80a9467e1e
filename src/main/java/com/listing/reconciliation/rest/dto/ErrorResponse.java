package com.listing.reconciliation.rest.dto;

import com.listing.reconciliation.review.ChangeNotFoundException;
import com.listing.reconciliation.review.InvalidStateTransitionException;
import com.listing.reconciliation.session.SessionBuildException;
import com.listing.reconciliation.session.SessionNotFoundException;
import com.listing.reconciliation.session.SessionUnavailableException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Error body returned by every endpoint.
 *
 * <p>{@code details} names the session or change the failure concerns, and for a rejected
 * status change the statuses involved, so a review UI can refresh the right row.</p>
 */
public record ErrorResponse(
        int status,
        String error,
        ErrorCode code,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ErrorResponse of(ErrorCode code, String message, String path, Map<String, String> details) {
        return new ErrorResponse(code.status(), code.reason(), code, message, path, Instant.now(), details);
    }

    /**
     * Maps an exception raised by the reconciliation service to its error body. Exceptions the
     * service does not raise on purpose become {@link ErrorCode#INTERNAL_ERROR}.
     */
    public static ErrorResponse from(Exception e, String path) {
        Map<String, String> details = new LinkedHashMap<>();
        ErrorCode code;
        if (e instanceof SessionNotFoundException notFound) {
            code = ErrorCode.SESSION_NOT_FOUND;
            details.put("sessionId", notFound.getSessionId());
        } else if (e instanceof ChangeNotFoundException notFound) {
            code = ErrorCode.CHANGE_NOT_FOUND;
            details.put("changeId", notFound.getChangeId());
        } else if (e instanceof InvalidStateTransitionException transition) {
            code = ErrorCode.INVALID_TRANSITION;
            details.put("changeId", String.valueOf(transition.getChangeId()));
            details.put("from", String.valueOf(transition.getFrom()));
            details.put("to", String.valueOf(transition.getTo()));
        } else if (e instanceof SessionUnavailableException unavailable) {
            code = ErrorCode.SESSION_UNAVAILABLE;
            details.put("sessionId", unavailable.getSessionId());
            details.put("sessionStatus", String.valueOf(unavailable.getStatus()));
        } else if (e instanceof IllegalArgumentException) {
            code = ErrorCode.INVALID_REQUEST;
        } else if (e instanceof SessionBuildException failed) {
            code = ErrorCode.SESSION_BUILD_FAILED;
            details.put("sessionId", failed.getSessionId());
        } else {
            code = ErrorCode.INTERNAL_ERROR;
        }
        details.values().removeIf(Objects::isNull);
        return of(code, e.getMessage(), path, details);
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
