package com.dcruver.medi.search;

import com.dcruver.medi.error.IndexException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.LockObtainFailedException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Disk-backed full-text index of notes, derived from the primary store and rebuildable from it.
 * <p>
 * Only one {@link SearchIndexWriter} may be open at a time; Lucene's write lock enforces this
 * across threads and processes. Readers are refreshed after every commit.
 */
@Slf4j
public class SearchIndex implements Closeable {

    private final Path path;
    private final Directory directory;
    private final Analyzer analyzer;
    private final double writerBufferMb;
    private final SearcherManager searcherManager;

    SearchIndex(Path path, Directory directory, Analyzer analyzer, double writerBufferMb,
                        SearcherManager searcherManager) {
        this.path = path;
        this.directory = directory;
        this.analyzer = analyzer;
        this.writerBufferMb = writerBufferMb;
        this.searcherManager = searcherManager;
    }

    /**
     * Open the index at {@code path}, creating the directory and an empty index on first use.
     * Safe to call on every startup.
     */
    public static SearchIndex openOrCreate(Path path, double writerBufferMb) {
        try {
            Files.createDirectories(path);
            Directory directory = FSDirectory.open(path);
            Analyzer analyzer = NoteSchema.analyzer();

            if (!DirectoryReader.indexExists(directory)) {
                IndexWriterConfig config = new IndexWriterConfig(analyzer)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
                try (IndexWriter writer = new IndexWriter(directory, config)) {
                    writer.commit();
                }
                log.info("Created search index at {}", path);
            }

            return new SearchIndex(path, directory, analyzer, writerBufferMb, new SearcherManager(directory, null));
        } catch (IOException e) {
            throw new IndexException("Failed to open search index at " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Acquire the exclusive writer. Callers must close it within the same operation.
     *
     * @throws IndexException if another writer holds the index lock
     */
    public SearchIndexWriter beginWrite() {
        IndexWriterConfig config = new IndexWriterConfig(analyzer)
            .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
            .setRAMBufferSizeMB(writerBufferMb)
            .setCommitOnClose(false);
        try {
            return new SearchIndexWriter(this, new IndexWriter(directory, config));
        } catch (LockObtainFailedException e) {
            throw new IndexException("Search index at " + path + " is locked by another writer", e);
        } catch (IOException e) {
            throw new IndexException("Failed to open search index writer: " + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    Analyzer getAnalyzer() {
        return analyzer;
    }

    /**
     * Make the latest commit visible to subsequent searches.
     */
    void refresh() {
        try {
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new IndexException("Failed to reload search index: " + e.getMessage(), e);
        }
    }

    IndexSearcher acquireSearcher() {
        try {
            return searcherManager.acquire();
        } catch (IOException e) {
            throw new IndexException("Failed to open search index reader: " + e.getMessage(), e);
        }
    }

    void releaseSearcher(IndexSearcher searcher) {
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            throw new IndexException("Failed to release search index reader: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            searcherManager.close();
        } finally {
            directory.close();
            analyzer.close();
        }
        log.debug("Closed search index at {}", path);
    }
}
