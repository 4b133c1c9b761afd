package com.dcruver.medi.domain;

/**
 * Task state. Any status can be set from any other.
 */
public enum TaskStatus {
    OPEN("Open"),
    PRIO("Prio"),
    DONE("Done");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
