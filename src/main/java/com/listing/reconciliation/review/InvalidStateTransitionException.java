package com.listing.reconciliation.review;

import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;

/**
 * A status transition the change state machine does not permit. Nothing was modified.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final String changeId;
    private final ChangeStatus from;
    private final ChangeStatus to;

    public InvalidStateTransitionException(String changeId, ChangeStatus from, ChangeStatus to, String reason) {
        super("Cannot move change " + changeId + " from " + from.wireName() + " to " + to.wireName() + ": " + reason);
        this.changeId = changeId;
        this.from = from;
        this.to = to;
    }

    public static InvalidStateTransitionException notAllowed(String changeId, ChangeStatus from, ChangeStatus to) {
        return new InvalidStateTransitionException(changeId, from, to,
                from.isTerminal() ? from.wireName() + " is terminal" : "allowed targets are " + from.allowedTargets());
    }

    public static InvalidStateTransitionException missingReference(String changeId, ChangeStatus from, ChangeStatus to) {
        return new InvalidStateTransitionException(changeId, from, to,
                ChangeType.MISSING_REFERENCE.wireName() + " changes cannot be reviewed until the reference exists");
    }

    public String getChangeId() {
        return changeId;
    }

    public ChangeStatus getFrom() {
        return from;
    }

    public ChangeStatus getTo() {
        return to;
    }
}
