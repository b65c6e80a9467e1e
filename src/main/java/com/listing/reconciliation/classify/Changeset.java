package com.listing.reconciliation.classify;

import com.listing.reconciliation.core.model.ChangeType;

import java.util.List;

/**
 * Everything one classification pass produced.
 *
 * @param changes        proposed changes, candidates in extraction order followed by deletes
 * @param conflicts      match conflicts resolved during assignment
 * @param totalExtracted number of candidates classified
 * @param totalExisting  number of existing listings considered
 */
public record Changeset(List<ProposedChange> changes, List<MatchConflict> conflicts,
                        int totalExtracted, int totalExisting) {

    public Changeset {
        changes = List.copyOf(changes);
        conflicts = List.copyOf(conflicts);
    }

    public long countOf(ChangeType type) {
        return changes.stream().filter(change -> change.type() == type).count();
    }

    public List<ProposedChange> ofType(ChangeType type) {
        return changes.stream().filter(change -> change.type() == type).toList();
    }
}
