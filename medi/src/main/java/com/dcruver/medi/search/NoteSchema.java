package com.dcruver.medi.search;

import com.dcruver.medi.domain.Note;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;

/**
 * Fixed layout of a note's search document.
 * {@code key} is an exact-match token; the other fields are analyzed full text.
 * Every field is stored.
 */
public final class NoteSchema {

    public static final String KEY = "key";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String TAGS = "tags";

    /** Longest key, in UTF-8 bytes, that fits in a single index term. */
    public static final int MAX_KEY_BYTES = IndexWriter.MAX_TERM_LENGTH;

    /** Fields a free-text query is parsed against. */
    static final String[] QUERY_FIELDS = {TITLE, CONTENT, TAGS};

    private NoteSchema() {
    }

    static Analyzer analyzer() {
        return new StandardAnalyzer();
    }

    static Document toDocument(Note note) {
        Document doc = new Document();
        doc.add(new StringField(KEY, note.getKey(), Field.Store.YES));
        doc.add(new TextField(TITLE, note.getTitle(), Field.Store.YES));
        doc.add(new TextField(CONTENT, note.getContent(), Field.Store.YES));
        for (String tag : note.getTags()) {
            doc.add(new TextField(TAGS, tag, Field.Store.YES));
        }
        return doc;
    }
}
