package com.dcruver.medi.error;

/**
 * Base type for every failure surfaced by the note store, search index and task tracker.
 */
public class MediException extends RuntimeException {

    public MediException(String message) {
        super(message);
    }

    public MediException(String message, Throwable cause) {
        super(message, cause);
    }
}
