package com.dcruver.medi.error;

/**
 * I/O or corruption problem in the primary store. Fatal for the current operation.
 */
public class StorageException extends MediException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
