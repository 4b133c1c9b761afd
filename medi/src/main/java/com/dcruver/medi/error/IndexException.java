package com.dcruver.medi.error;

/**
 * Failure inside the full-text search index.
 * Never implies that a primary store write was undone.
 */
public class IndexException extends MediException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
