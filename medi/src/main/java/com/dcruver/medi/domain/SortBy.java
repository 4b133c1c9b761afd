package com.dcruver.medi.domain;

import java.util.Comparator;

/**
 * Orderings offered when listing notes.
 */
public enum SortBy {
    KEY(Comparator.comparing(Note::getKey)),
    CREATED(Comparator.comparing(Note::getCreatedAt).thenComparing(Note::getKey)),
    MODIFIED(Comparator.comparing(Note::getModifiedAt).thenComparing(Note::getKey));

    private final Comparator<Note> comparator;

    SortBy(Comparator<Note> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Note> comparator() {
        return comparator;
    }
}
