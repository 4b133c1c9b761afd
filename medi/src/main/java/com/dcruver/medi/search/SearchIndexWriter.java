package com.dcruver.medi.search;

import com.dcruver.medi.domain.Note;
import com.dcruver.medi.error.IndexException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;

import java.io.Closeable;
import java.io.IOException;

/**
 * Exclusive handle for mutating the search index.
 * <p>
 * Adds and deletes are buffered until {@link #commit()}. Closing with uncommitted
 * operations rolls them back, so a replace (delete + add) is visible all at once or not at all.
 */
@Slf4j
public class SearchIndexWriter implements Closeable {

    private final SearchIndex index;
    private final IndexWriter writer;
    private boolean pending;

    SearchIndexWriter(SearchIndex index, IndexWriter writer) {
        this.index = index;
        this.writer = writer;
    }

    /**
     * Append a document for {@code note}. Existing documents with the same key are left alone.
     */
    public void add(Note note) {
        try {
            writer.addDocument(NoteSchema.toDocument(note));
            pending = true;
        } catch (IOException | RuntimeException e) {
            throw new IndexException("Failed to index note '" + note.getKey() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Mark every document with exactly this key for removal. No-op for unknown keys.
     */
    public void deleteByKey(String key) {
        try {
            writer.deleteDocuments(new Term(NoteSchema.KEY, key));
            pending = true;
        } catch (IOException | RuntimeException e) {
            throw new IndexException("Failed to remove note '" + key + "' from index: " + e.getMessage(), e);
        }
    }

    public void deleteAll() {
        try {
            writer.deleteAll();
            pending = true;
        } catch (IOException e) {
            throw new IndexException("Failed to clear search index: " + e.getMessage(), e);
        }
    }

    /**
     * Make buffered operations durable and visible to searches.
     * A failed reader reload after a durable commit is only logged; searches reload again.
     */
    public void commit() {
        try {
            writer.commit();
            pending = false;
        } catch (IOException e) {
            throw new IndexException("Failed to commit search index: " + e.getMessage(), e);
        }
        try {
            index.refresh();
        } catch (IndexException e) {
            log.warn("Search index committed but reader reload failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            if (pending) {
                log.debug("Rolling back uncommitted index changes");
                writer.rollback();
            } else {
                writer.close();
            }
        } catch (IOException e) {
            throw new IndexException("Failed to release search index writer: " + e.getMessage(), e);
        }
    }
}
