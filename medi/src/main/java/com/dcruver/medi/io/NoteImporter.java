package com.dcruver.medi.io;

import com.dcruver.medi.domain.Note;
import com.dcruver.medi.domain.NoteService;
import com.dcruver.medi.error.MediException;
import com.dcruver.medi.error.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imports markdown files as notes. The file body becomes the note content verbatim.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoteImporter {

    private static final String MARKDOWN_EXTENSION = ".md";

    private final NoteService noteService;

    /**
     * Import one file under {@code key}. Existing notes are skipped unless {@code overwrite}.
     */
    public ImportResult importFile(Path file, String key, boolean overwrite) {
        if (!Files.isRegularFile(file)) {
            throw new StorageException("Import file does not exist: " + file);
        }

        boolean exists = noteService.exists(key);
        if (exists && !overwrite) {
            log.info("Skipping import of {}: key '{}' exists", file, key);
            return result(key, file, ImportResult.Outcome.SKIPPED,
                "Key '" + key + "' already exists, use --overwrite to replace it");
        }

        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        Note existing = exists ? noteService.get(key) : null;
        Note note = Note.builder()
            .key(key)
            .title(existing != null ? existing.getTitle() : key)
            .tags(existing != null ? existing.getTags() : List.of())
            .content(content)
            .build();
        noteService.put(note);

        log.info("Imported {} as '{}'", file, key);
        return result(key, file, exists ? ImportResult.Outcome.OVERWRITTEN : ImportResult.Outcome.IMPORTED,
            "Imported '" + key + "'");
    }

    /**
     * Import every {@code *.md} file directly inside {@code dir}, keyed by file name without
     * the extension, in name order. A failure on one file does not stop the others.
     */
    public List<ImportResult> importDirectory(Path dir, boolean overwrite) {
        if (!Files.isDirectory(dir)) {
            throw new StorageException("Import directory does not exist: " + dir);
        }

        List<Path> files;
        try (Stream<Path> paths = Files.list(dir)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(MARKDOWN_EXTENSION))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list " + dir + ": " + e.getMessage(), e);
        }

        log.info("Found {} markdown files in {}", files.size(), dir);

        List<ImportResult> results = new ArrayList<>();
        for (Path file : files) {
            String key = keyFor(file);
            try {
                results.add(importFile(file, key, overwrite));
            } catch (MediException e) {
                log.error("Failed to import {}", file, e);
                results.add(result(key, file, ImportResult.Outcome.FAILED, e.getMessage()));
            }
        }
        return results;
    }

    static String keyFor(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(MARKDOWN_EXTENSION)
            ? name.substring(0, name.length() - MARKDOWN_EXTENSION.length())
            : name;
    }

    private ImportResult result(String key, Path file, ImportResult.Outcome outcome, String message) {
        return ImportResult.builder()
            .key(key)
            .source(file)
            .outcome(outcome)
            .message(message)
            .build();
    }
}
