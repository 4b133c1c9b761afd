package com.dcruver.medi.error;

public class BadQueryException extends IndexException {

    private final String query;

    public BadQueryException(String query, Throwable cause) {
        super("Invalid search query '" + query + "': " + cause.getMessage(), cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
