package com.dcruver.medi.error;

public class KeyExistsException extends MediException {

    private final String key;

    public KeyExistsException(String key) {
        super("Key '" + key + "' already exists. Use 'edit' to modify it.");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
