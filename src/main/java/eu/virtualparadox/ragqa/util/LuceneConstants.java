package eu.virtualparadox.ragqa.util;

public class LuceneConstants {
    public static final String FIELD_PASSAGE_ID = "passageId";
    public static final String FIELD_SOURCE_ID = "sourceId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_SEQUENCE = "sequence";
    public static final String FIELD_START_CHAR = "startChar";
    public static final String FIELD_END_CHAR = "endChar";
    public static final String FIELD_WORD_COUNT = "wordCount";
    public static final String FIELD_SECTION = "section";
    public static final String FIELD_ORDINAL = "ordinal";

    private LuceneConstants() {
        // prevent instantiation
    }
}
