package com.dcruver.medi.error;

/**
 * The primary store write for {@code key} is durable but the matching index update failed.
 * Running a reindex restores the index.
 */
public class StaleIndexException extends IndexException {

    private final String key;

    public StaleIndexException(String key, String operation, Throwable cause) {
        super(String.format("Note '%s' was %s but the search index could not be updated (%s). "
            + "Run 'reindex' to repair it.", key, operation, cause.getMessage()), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
