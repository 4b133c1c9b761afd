package com.dcruver.medi.io;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of importing one file.
 */
@Data
@Builder
public class ImportResult {
    private final String key;
    private final Path source;
    private final Outcome outcome;
    private final String message;

    public enum Outcome {
        IMPORTED,
        OVERWRITTEN,
        SKIPPED,
        FAILED
    }
}
