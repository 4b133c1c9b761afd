package com.dcruver.medi.io;

import com.dcruver.medi.domain.Note;
import com.dcruver.medi.domain.NoteService;
import com.dcruver.medi.domain.SortBy;
import com.dcruver.medi.error.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes notes out as markdown files or as a single JSON document.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoteExporter {

    static final String JSON_FILE_NAME = "medi_export.json";

    private final NoteService noteService;
    private final ObjectMapper objectMapper;

    /**
     * Export notes in {@code format}. An empty tag filter exports every note.
     *
     * @return number of notes exported
     */
    public int export(Path target, ExportFormat format, Collection<String> tags) {
        return switch (format) {
            case MARKDOWN -> exportMarkdown(target, tags);
            case JSON -> exportJson(target, tags);
        };
    }

    /**
     * One {@code <key>.md} per note holding the raw content. Keys containing {@code /} become
     * subdirectories. Nothing is written if any key would land outside {@code dir}.
     */
    public int exportMarkdown(Path dir, Collection<String> tags) {
        List<Note> notes = select(tags);
        Path root = dir.toAbsolutePath().normalize();

        Map<Path, Note> files = new LinkedHashMap<>();
        for (Note note : notes) {
            files.put(markdownFile(root, note.getKey()), note);
        }

        try {
            Files.createDirectories(root);
            for (Map.Entry<Path, Note> entry : files.entrySet()) {
                Files.createDirectories(entry.getKey().getParent());
                Files.writeString(entry.getKey(), entry.getValue().getContent());
            }
        } catch (IOException e) {
            throw new StorageException("Failed to export to " + dir + ": " + e.getMessage(), e);
        }
        log.info("Exported {} notes as markdown to {}", notes.size(), dir);
        return notes.size();
    }

    static Path markdownFile(Path root, String key) {
        Path file;
        try {
            file = root.resolve(key + ".md").normalize();
        } catch (InvalidPathException e) {
            throw new StorageException("Note '" + key + "' cannot be exported: " + e.getMessage(), e);
        }
        if (!file.startsWith(root)) {
            throw new StorageException("Note '" + key + "' cannot be exported: path leaves " + root);
        }
        return file;
    }

    /**
     * A pretty-printed JSON array of notes. When {@code target} is a directory the file is
     * written inside it as {@value #JSON_FILE_NAME}.
     */
    public int exportJson(Path target, Collection<String> tags) {
        List<Note> notes = select(tags);
        Path file = Files.isDirectory(target) ? target.resolve(JSON_FILE_NAME) : target;
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(notes));
        } catch (IOException e) {
            throw new StorageException("Failed to export to " + file + ": " + e.getMessage(), e);
        }
        log.info("Exported {} notes as JSON to {}", notes.size(), file);
        return notes.size();
    }

    private List<Note> select(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return noteService.list(SortBy.KEY);
        }
        return noteService.getByTags(tags);
    }
}
