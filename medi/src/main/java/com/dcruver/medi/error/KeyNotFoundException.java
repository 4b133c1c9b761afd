package com.dcruver.medi.error;

public class KeyNotFoundException extends MediException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key '" + key + "' not found in the database");
        this.key = key;
    }

    public KeyNotFoundException(String key, String message) {
        super(message);
        this.key = key;
    }

    public static KeyNotFoundException task(long id) {
        return new KeyNotFoundException(String.valueOf(id), "Task with ID " + id + " not found");
    }

    public String getKey() {
        return key;
    }
}
