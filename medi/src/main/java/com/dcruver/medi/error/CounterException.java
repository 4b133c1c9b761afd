package com.dcruver.medi.error;

/**
 * The task id counter could not produce a value. Indicates a broken internal invariant.
 */
public class CounterException extends MediException {

    public CounterException(String message) {
        super(message);
    }

    public CounterException(String message, Throwable cause) {
        super(message, cause);
    }
}
