package com.dcruver.medi.domain;

import com.dcruver.medi.error.KeyExistsException;
import com.dcruver.medi.search.NoteSchema;
import com.dcruver.medi.search.NoteSearcher;
import com.dcruver.medi.store.NoteRepository;
import com.dcruver.medi.sync.ConsistencyReport;
import com.dcruver.medi.sync.IndexedNoteStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Note lifecycle: create, edit, read, list, delete and search.
 * Every write goes through {@link IndexedNoteStore}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoteService {

    private final IndexedNoteStore indexedNoteStore;
    private final NoteRepository noteRepository;
    private final NoteSearcher noteSearcher;
    private final Clock clock;

    /**
     * Create a new note. The title defaults to the key.
     *
     * @throws KeyExistsException if a note with this key already exists
     */
    public Note create(String key, String title, String content, List<String> tags) {
        checkKey(key);
        if (noteRepository.exists(key)) {
            throw new KeyExistsException(key);
        }

        Instant now = clock.instant();
        Note note = Note.builder()
            .key(key)
            .title(title == null || title.isBlank() ? key : title)
            .content(content)
            .tags(tags)
            .createdAt(now)
            .modifiedAt(now)
            .build();

        indexedNoteStore.save(note);
        return note;
    }

    /**
     * Apply an edit to an existing note. Null {@code content} or {@code title} leaves the field as is.
     * Added tags are appended even if already present; removed tags drop every occurrence.
     * An edit that changes nothing is not written.
     *
     * @throws com.dcruver.medi.error.KeyNotFoundException if the note does not exist
     */
    public Note edit(String key, String content, String title, List<String> addTags, List<String> removeTags) {
        Note existing = noteRepository.get(key);

        List<String> tags = new ArrayList<>(existing.getTags());
        if (removeTags != null) {
            tags.removeIf(removeTags::contains);
        }
        if (addTags != null) {
            tags.addAll(addTags);
        }

        Note edited = existing
            .withContent(content != null ? content : existing.getContent())
            .withTitle(title != null && !title.isBlank() ? title : existing.getTitle())
            .withTags(tags);

        if (edited.equals(existing)) {
            log.debug("Edit of '{}' changes nothing", key);
            return existing;
        }

        Note saved = edited.withModifiedAt(nextModified(existing.getModifiedAt()));
        indexedNoteStore.save(saved);
        return saved;
    }

    /**
     * Store {@code note} as given, replacing any existing note with the same key but keeping
     * the existing creation time. Used by imports.
     */
    public Note put(Note note) {
        checkKey(note.getKey());
        Instant now = clock.instant();
        Note toSave = noteRepository.find(note.getKey())
            .map(existing -> note.withCreatedAt(existing.getCreatedAt())
                .withModifiedAt(nextModified(existing.getModifiedAt())))
            .orElse(note.withCreatedAt(now).withModifiedAt(now));

        indexedNoteStore.save(toSave);
        return toSave;
    }

    public boolean exists(String key) {
        return noteRepository.exists(key);
    }

    public Note get(String key) {
        return noteRepository.get(key);
    }

    /**
     * Notes carrying at least one of {@code tags}, ordered by key.
     */
    public List<Note> getByTags(Collection<String> tags) {
        return noteRepository.findAll().stream()
            .filter(note -> note.hasAnyTag(tags))
            .toList();
    }

    public List<Note> list(SortBy sortBy) {
        List<Note> notes = new ArrayList<>(noteRepository.findAll());
        notes.sort(sortBy.comparator());
        return notes;
    }

    public void delete(String key) {
        indexedNoteStore.delete(key);
    }

    public List<String> search(String query) {
        return noteSearcher.search(query);
    }

    public int reindex() {
        return indexedNoteStore.reindexAll();
    }

    public ConsistencyReport check() {
        return indexedNoteStore.checkConsistency();
    }

    /**
     * Keys are stored as a single index term, so they must fit within its byte limit.
     */
    private static void checkKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Note key must not be blank");
        }
        int bytes = key.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > NoteSchema.MAX_KEY_BYTES) {
            throw new IllegalArgumentException(String.format(
                "Note key is %d bytes long, the limit is %d", bytes, NoteSchema.MAX_KEY_BYTES));
        }
    }

    /**
     * Current time, pushed past {@code previous} when the clock has not moved since the last write.
     */
    private Instant nextModified(Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusNanos(1_000);
        }
        return now;
    }
}
