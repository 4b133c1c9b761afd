package com.dcruver.medi.sync;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * Differences between the notes in the primary store and the documents in the search index.
 */
@Data
@Builder
public class ConsistencyReport {
    private final int storedNotes;
    private final int indexedDocuments;

    // stored but not searchable
    private final Set<String> missingFromIndex;
    // searchable but no longer stored
    private final Set<String> orphanedInIndex;
    // more than one document for the key
    private final Set<String> duplicatedInIndex;

    public boolean isConsistent() {
        return missingFromIndex.isEmpty() && orphanedInIndex.isEmpty() && duplicatedInIndex.isEmpty();
    }
}
