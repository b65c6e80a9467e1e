package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.ChangePayload;
import com.listing.reconciliation.core.model.CreatePayload;
import com.listing.reconciliation.core.model.DeletePayload;
import com.listing.reconciliation.core.model.MissingReference;
import com.listing.reconciliation.core.model.MissingReferenceKind;
import com.listing.reconciliation.core.model.MissingReferencePayload;
import com.listing.reconciliation.core.model.UnchangedPayload;
import com.listing.reconciliation.core.model.UpdatePayload;

/**
 * One-line, reviewer-facing descriptions of change payloads.
 */
public final class ChangeSummaries {

    private ChangeSummaries() {
    }

    public static String describe(ChangePayload payload) {
        if (payload instanceof CreatePayload create) {
            int offers = create.extracted().offers().size();
            return "New listing: " + create.extracted().displayName() + " (" + offers
                    + (offers == 1 ? " offer)" : " offers)");
        }
        if (payload instanceof UpdatePayload update) {
            return "Updated " + update.extracted().displayName() + ": " + String.join(", ", update.changedFieldNames());
        }
        if (payload instanceof DeletePayload delete) {
            return "Not in price list: " + delete.existing().displayName();
        }
        if (payload instanceof UnchangedPayload unchanged) {
            return "No changes: " + unchanged.extracted().displayName();
        }
        if (payload instanceof MissingReferencePayload missing) {
            return describeMissing(missing.missing());
        }
        throw new IllegalArgumentException("Unsupported payload: " + payload.getClass().getName());
    }

    private static String describeMissing(MissingReference missing) {
        if (missing.kind() == MissingReferenceKind.MAKE) {
            return "Make '" + nullToEmpty(missing.rawMake()) + "' does not exist";
        }
        return "Model '" + nullToEmpty(missing.rawModel()) + "' does not exist for make "
                + nullToEmpty(missing.rawMake());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
