package com.dcruver.medi.store;

import com.dcruver.medi.domain.Note;
import com.dcruver.medi.error.KeyNotFoundException;
import com.dcruver.medi.error.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON persistence of notes in the {@code notes/} namespace of the primary store.
 * Does not touch the search index; mutations go through {@code IndexedNoteStore}.
 */
@Component
@Slf4j
public class NoteRepository {

    public static final String NOTE_PREFIX = "notes/";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public NoteRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public boolean exists(String key) {
        return store.contains(storeKey(key));
    }

    public void save(Note note) {
        store.put(storeKey(note.getKey()), encode(note));
        log.debug("Stored note {}", note.getKey());
    }

    public Optional<Note> find(String key) {
        return store.get(storeKey(key)).map(this::decode);
    }

    public Note get(String key) {
        return find(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    /**
     * @throws KeyNotFoundException if the note does not exist
     */
    public void delete(String key) {
        try {
            store.delete(storeKey(key));
        } catch (KeyNotFoundException e) {
            // report the note key, not the namespaced store key
            throw new KeyNotFoundException(key);
        }
    }

    /**
     * Every stored note, ordered by key.
     */
    public List<Note> findAll() {
        List<Note> notes = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.scanPrefix(NOTE_PREFIX)) {
            notes.add(decode(entry.getValue()));
        }
        return notes;
    }

    static String storeKey(String key) {
        return NOTE_PREFIX + key;
    }

    private byte[] encode(Note note) {
        try {
            return objectMapper.writeValueAsBytes(note);
        } catch (IOException e) {
            throw new StorageException("Failed to serialize note '" + note.getKey() + "'", e);
        }
    }

    private Note decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, Note.class);
        } catch (IOException e) {
            throw new StorageException("Corrupt note record: " + e.getMessage(), e);
        }
    }
}
