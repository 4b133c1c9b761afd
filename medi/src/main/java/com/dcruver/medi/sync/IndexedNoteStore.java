package com.dcruver.medi.sync;

import com.dcruver.medi.domain.Note;
import com.dcruver.medi.error.IndexException;
import com.dcruver.medi.error.StaleIndexException;
import com.dcruver.medi.search.NoteSearcher;
import com.dcruver.medi.search.SearchIndex;
import com.dcruver.medi.search.SearchIndexWriter;
import com.dcruver.medi.store.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Single path for every note mutation. Keeps the search index in step with the primary store.
 * <p>
 * The store is authoritative: it is always written first, and a failed store write never
 * reaches the index. An index failure after a durable store write leaves the store as written
 * and raises {@link StaleIndexException}; {@link #reindexAll()} rebuilds the index from the store.
 * Each operation opens, uses and closes its own index writer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexedNoteStore {

    private final NoteRepository noteRepository;
    private final SearchIndex searchIndex;
    private final NoteSearcher noteSearcher;

    /**
     * Persist {@code note} and replace its search document in one index commit.
     */
    public void save(Note note) {
        noteRepository.save(note);

        try (SearchIndexWriter writer = searchIndex.beginWrite()) {
            writer.deleteByKey(note.getKey());
            writer.add(note);
            writer.commit();
        } catch (IndexException e) {
            log.warn("Note '{}' saved but index update failed: {}", note.getKey(), e.getMessage());
            throw new StaleIndexException(note.getKey(), "saved", e);
        }
        log.info("Saved note '{}'", note.getKey());
    }

    /**
     * Remove the note from the store, then from the index.
     *
     * @throws com.dcruver.medi.error.KeyNotFoundException if the note does not exist; the index is not touched
     */
    public void delete(String key) {
        noteRepository.delete(key);

        try (SearchIndexWriter writer = searchIndex.beginWrite()) {
            writer.deleteByKey(key);
            writer.commit();
        } catch (IndexException e) {
            log.warn("Note '{}' deleted but index update failed: {}", key, e.getMessage());
            throw new StaleIndexException(key, "deleted", e);
        }
        log.info("Deleted note '{}'", key);
    }

    /**
     * Rebuild the whole index from the primary store in a single commit.
     *
     * @return number of notes indexed
     */
    public int reindexAll() {
        List<Note> notes = noteRepository.findAll();

        try (SearchIndexWriter writer = searchIndex.beginWrite()) {
            writer.deleteAll();
            for (Note note : notes) {
                writer.add(note);
            }
            writer.commit();
        }
        log.info("Reindexed {} notes", notes.size());
        return notes.size();
    }

    /**
     * Compare stored note keys with indexed document keys. Read-only.
     */
    public ConsistencyReport checkConsistency() {
        Set<String> storedKeys = new TreeSet<>();
        for (Note note : noteRepository.findAll()) {
            storedKeys.add(note.getKey());
        }

        List<String> indexed = noteSearcher.indexedKeys();
        Set<String> seen = new HashSet<>();
        Set<String> duplicated = new TreeSet<>();
        for (String key : indexed) {
            if (!seen.add(key)) {
                duplicated.add(key);
            }
        }

        Set<String> missing = new TreeSet<>(storedKeys);
        missing.removeAll(seen);
        Set<String> orphaned = new TreeSet<>(seen);
        orphaned.removeAll(storedKeys);

        ConsistencyReport report = ConsistencyReport.builder()
            .storedNotes(storedKeys.size())
            .indexedDocuments(indexed.size())
            .missingFromIndex(missing)
            .orphanedInIndex(orphaned)
            .duplicatedInIndex(duplicated)
            .build();

        if (!report.isConsistent()) {
            log.warn("Search index out of sync: {} missing, {} orphaned, {} duplicated",
                missing.size(), orphaned.size(), duplicated.size());
        }
        return report;
    }
}
