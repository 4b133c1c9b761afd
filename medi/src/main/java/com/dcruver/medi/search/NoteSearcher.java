package com.dcruver.medi.search;

import com.dcruver.medi.config.MediProperties;
import com.dcruver.medi.error.BadQueryException;
import com.dcruver.medi.error.IndexException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Ranked free-text retrieval of note keys.
 * <p>
 * Queries use Lucene's classic syntax against title, content and tags (terms OR-ed, BM25 scores
 * summed across fields). Ties keep index order.
 */
@Component
@Slf4j
public class NoteSearcher {

    private static final Set<String> KEY_ONLY = Set.of(NoteSchema.KEY);

    private final SearchIndex index;
    private final int limit;

    @Autowired
    public NoteSearcher(SearchIndex index, MediProperties properties) {
        this(index, properties.getSearch().getLimit());
    }

    public NoteSearcher(SearchIndex index, int limit) {
        this.index = index;
        this.limit = limit;
    }

    /**
     * Keys of the best matching notes, most relevant first, at most the configured limit.
     * A blank query matches nothing.
     *
     * @throws BadQueryException if {@code queryText} is not valid query syntax
     */
    public List<String> search(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return List.of();
        }
        Query query = parse(queryText);
        List<String> keys = collectKeys(query, limit);
        log.debug("Query '{}' matched {} notes", queryText, keys.size());
        return keys;
    }

    /**
     * Key of every live document, one entry per document (a key indexed twice appears twice).
     */
    public List<String> indexedKeys() {
        return collectKeys(new MatchAllDocsQuery(), -1);
    }

    private Query parse(String queryText) {
        MultiFieldQueryParser parser = new MultiFieldQueryParser(NoteSchema.QUERY_FIELDS, index.getAnalyzer());
        try {
            return parser.parse(queryText);
        } catch (ParseException e) {
            throw new BadQueryException(queryText, e);
        }
    }

    private List<String> collectKeys(Query query, int max) {
        index.refresh();
        IndexSearcher searcher = index.acquireSearcher();
        try {
            int n = max > 0 ? max : Math.max(1, searcher.getIndexReader().maxDoc());
            TopDocs topDocs = searcher.search(query, n);
            StoredFields storedFields = searcher.storedFields();

            List<String> keys = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                String key = storedFields.document(scoreDoc.doc, KEY_ONLY).get(NoteSchema.KEY);
                if (key != null) {
                    keys.add(key);
                }
            }
            return keys;
        } catch (IOException e) {
            throw new IndexException("Search failed: " + e.getMessage(), e);
        } finally {
            index.releaseSearcher(searcher);
        }
    }
}
