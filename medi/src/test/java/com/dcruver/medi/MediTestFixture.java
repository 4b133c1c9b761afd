package com.dcruver.medi;

import com.dcruver.medi.config.DataSourceConfig;
import com.dcruver.medi.domain.NoteService;
import com.dcruver.medi.domain.TaskService;
import com.dcruver.medi.search.NoteSearcher;
import com.dcruver.medi.search.SearchIndex;
import com.dcruver.medi.store.KeyValueStore;
import com.dcruver.medi.store.NoteRepository;
import com.dcruver.medi.store.TaskIdGenerator;
import com.dcruver.medi.store.TaskRepository;
import com.dcruver.medi.sync.IndexedNoteStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Full store + index stack in a temporary directory, wired the way the application context wires it.
 */
public class MediTestFixture implements AutoCloseable {

    public final Path dbDir;
    public final ObjectMapper objectMapper;
    public final MutableClock clock;
    public final KeyValueStore store;
    public final NoteRepository noteRepository;
    public final TaskRepository taskRepository;
    public final TaskIdGenerator taskIdGenerator;
    public final SearchIndex searchIndex;
    public final NoteSearcher noteSearcher;
    public final IndexedNoteStore indexedNoteStore;
    public final NoteService noteService;
    public final TaskService taskService;

    public MediTestFixture(Path dbDir) {
        this.dbDir = dbDir;
        this.objectMapper = objectMapper();
        this.clock = new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
        this.store = openStore(dbDir);
        this.noteRepository = new NoteRepository(store, objectMapper);
        this.taskRepository = new TaskRepository(store, objectMapper);
        this.taskIdGenerator = new TaskIdGenerator(store);
        this.searchIndex = SearchIndex.openOrCreate(dbDir.resolve("search_index"), 16.0);
        this.noteSearcher = new NoteSearcher(searchIndex, 10);
        this.indexedNoteStore = new IndexedNoteStore(noteRepository, searchIndex, noteSearcher);
        this.noteService = new NoteService(indexedNoteStore, noteRepository, noteSearcher, clock);
        this.taskService = new TaskService(taskRepository, taskIdGenerator, noteRepository, clock);
    }

    public static KeyValueStore openStore(Path dbDir) {
        KeyValueStore store = new KeyValueStore(DataSourceConfig.sqliteDataSource(dbDir, 5000));
        store.init();
        return store;
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void close() {
        try {
            searchIndex.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
