package com.dcruver.medi.sync;

import com.dcruver.medi.MediTestFixture;
import com.dcruver.medi.domain.Note;
import com.dcruver.medi.error.KeyNotFoundException;
import com.dcruver.medi.error.StaleIndexException;
import com.dcruver.medi.error.StorageException;
import com.dcruver.medi.search.SearchIndexWriter;
import com.dcruver.medi.store.NoteRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IndexedNoteStoreTest {

    @TempDir
    Path tempDir;

    private MediTestFixture fixture;
    private IndexedNoteStore indexedStore;

    @BeforeEach
    void setUp() {
        fixture = new MediTestFixture(tempDir);
        indexedStore = fixture.indexedNoteStore;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testSavedNoteIsSearchable() {
        indexedStore.save(note("n1", "Alpha", "rust systems", List.of("x")));

        assertEquals(List.of("n1"), fixture.noteSearcher.search("rust"));
        assertTrue(fixture.noteRepository.exists("n1"));
    }

    @Test
    void testDeletedNoteLeavesSearchResults() {
        indexedStore.save(note("n1", "Alpha", "rust systems", List.of("x")));

        indexedStore.delete("n1");

        assertTrue(fixture.noteSearcher.search("rust").isEmpty());
        KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> indexedStore.delete("n1"));
        assertEquals("n1", e.getKey());
    }

    @Test
    void testResaveReplacesDocument() {
        indexedStore.save(note("n1", "n1", "a", List.of()));
        indexedStore.save(note("n1", "n1", "b", List.of()));

        assertTrue(fixture.noteSearcher.search("a").isEmpty());
        assertEquals(List.of("n1"), fixture.noteSearcher.search("b"));
    }

    @Test
    void testRepeatedSavesNeverDuplicate() {
        for (int i = 0; i < 5; i++) {
            indexedStore.save(note("n1", "Same Title", "edit number " + i + " common", List.of()));
        }

        assertEquals(List.of("n1"), fixture.noteSearcher.search("common"));
        assertEquals(List.of("n1"), fixture.noteSearcher.indexedKeys());
    }

    @Test
    void testExactTitleQueryFollowsEveryOperation() {
        String[] keys = {"first", "second", "third"};
        for (String key : keys) {
            Note saved = note(key, "title" + key, "body", List.of());
            indexedStore.save(saved);
            assertEquals(List.of(key), fixture.noteSearcher.search("title:\"" + saved.getTitle() + "\""));
        }
        for (String key : keys) {
            indexedStore.delete(key);
            assertTrue(fixture.noteSearcher.search("title:\"title" + key + "\"").isEmpty());
        }
    }

    @Test
    void testReindexKeepsOnlyRemainingNotes() {
        for (int i = 1; i <= 5; i++) {
            indexedStore.save(note("n" + i, "Note " + i, "shared text", List.of()));
        }
        indexedStore.delete("n2");
        indexedStore.delete("n4");

        assertEquals(3, indexedStore.reindexAll());

        assertEquals(Set.of("n1", "n3", "n5"), Set.copyOf(fixture.noteSearcher.indexedKeys()));
        assertEquals(3, fixture.noteSearcher.indexedKeys().size());
        assertEquals(Set.of("n1", "n3", "n5"), Set.copyOf(fixture.noteSearcher.search("shared")));
    }

    @Test
    void testReindexTwiceGivesSameResults() {
        indexedStore.save(note("a", "Apple", "fruit salad recipe", List.of("food")));
        indexedStore.save(note("b", "Banana", "fruit smoothie", List.of("food", "drink")));
        indexedStore.save(note("c", "Carrot", "vegetable soup", List.of("food")));

        indexedStore.reindexAll();
        List<String> first = fixture.noteSearcher.search("fruit food");
        indexedStore.reindexAll();
        List<String> second = fixture.noteSearcher.search("fruit food");

        assertEquals(first, second);
        assertEquals(3, fixture.noteSearcher.indexedKeys().size());
    }

    @Test
    void testReindexOfEmptyStoreClearsIndex() {
        indexedStore.save(note("n1", "n1", "text", List.of()));
        fixture.noteRepository.delete("n1");

        assertEquals(0, indexedStore.reindexAll());
        assertTrue(fixture.noteSearcher.indexedKeys().isEmpty());
    }

    @Test
    void testStoreFailureNeverReachesIndex() {
        NoteRepository failing = new NoteRepository(fixture.store, fixture.objectMapper) {
            @Override
            public void save(Note note) {
                throw new StorageException("disk full");
            }
        };
        IndexedNoteStore broken = new IndexedNoteStore(failing, fixture.searchIndex, fixture.noteSearcher);

        assertThrows(StorageException.class, () -> broken.save(note("n1", "n1", "never indexed", List.of())));

        assertTrue(fixture.noteSearcher.search("indexed").isEmpty());
        assertFalse(fixture.noteRepository.exists("n1"));
    }

    @Test
    void testIndexFailureAfterSaveIsStaleAndRepairable() {
        StaleIndexException e;
        try (SearchIndexWriter held = fixture.searchIndex.beginWrite()) {
            e = assertThrows(StaleIndexException.class,
                () -> indexedStore.save(note("n1", "n1", "orphan content", List.of())));
        }

        assertEquals("n1", e.getKey());
        assertTrue(fixture.noteRepository.exists("n1"));
        assertTrue(fixture.noteSearcher.search("orphan").isEmpty());

        ConsistencyReport report = indexedStore.checkConsistency();
        assertFalse(report.isConsistent());
        assertEquals(Set.of("n1"), report.getMissingFromIndex());

        indexedStore.reindexAll();

        assertEquals(List.of("n1"), fixture.noteSearcher.search("orphan"));
        assertTrue(indexedStore.checkConsistency().isConsistent());
    }

    @Test
    void testIndexFailureAfterDeleteLeavesOrphan() {
        indexedStore.save(note("n1", "n1", "lingering", List.of()));

        try (SearchIndexWriter held = fixture.searchIndex.beginWrite()) {
            assertThrows(StaleIndexException.class, () -> indexedStore.delete("n1"));
        }

        assertFalse(fixture.noteRepository.exists("n1"));
        ConsistencyReport report = indexedStore.checkConsistency();
        assertEquals(Set.of("n1"), report.getOrphanedInIndex());
        assertEquals(0, report.getStoredNotes());
        assertEquals(1, report.getIndexedDocuments());
    }

    @Test
    void testCheckReportsDuplicates() {
        Note n = note("dup", "dup", "twice", List.of());
        fixture.noteRepository.save(n);
        try (SearchIndexWriter writer = fixture.searchIndex.beginWrite()) {
            writer.add(n);
            writer.add(n);
            writer.commit();
        }

        ConsistencyReport report = indexedStore.checkConsistency();

        assertEquals(Set.of("dup"), report.getDuplicatedInIndex());
        assertTrue(report.getMissingFromIndex().isEmpty());
        assertFalse(report.isConsistent());
    }

    @Test
    void testKeyTooLongForIndexIsStale() {
        String key = "k".repeat(40_000);

        StaleIndexException e = assertThrows(StaleIndexException.class,
            () -> indexedStore.save(note(key, "big", "oversized key", List.of())));

        assertEquals(key, e.getKey());
        assertTrue(fixture.noteRepository.exists(key));
        assertTrue(fixture.noteSearcher.search("oversized").isEmpty());
    }

    private static Note note(String key, String title, String content, List<String> tags) {
        Instant now = Instant.parse("2025-01-15T10:00:00Z");
        return Note.builder()
            .key(key)
            .title(title)
            .content(content)
            .tags(tags)
            .createdAt(now)
            .modifiedAt(now)
            .build();
    }
}
