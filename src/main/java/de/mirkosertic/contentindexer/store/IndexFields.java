package de.mirkosertic.contentindexer.store;

/**
 * Field names of the metadata index schema.
 */
public final class IndexFields {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the stored fields or their types change.
     * Version 1: Fingerprint, entry and category records.
     * Version 2: Added path_alias and redirect_url to entry records.
     */
    public static final int SCHEMA_VERSION = 2;

    public static final String SCHEMA_VERSION_KEY = "schema_version";

    // Common to all records
    public static final String RECORD_ID = "record_id";
    public static final String KIND = "kind";
    public static final String FILE_PATH = "file_path";

    // Fingerprint records
    public static final String FINGERPRINT = "fingerprint";
    public static final String FILE_MTIME = "file_mtime";

    // Entry records
    public static final String ENTRY_ID = "entry_id";
    public static final String UUID = "uuid";
    public static final String TITLE = "title";
    public static final String SLUG_TEXT = "slug_text";
    public static final String CATEGORY = "category";
    public static final String STATUS = "status";
    public static final String ENTRY_TYPE = "entry_type";
    public static final String ENTRY_DATE = "entry_date";
    public static final String REDIRECT_URL = "redirect_url";
    public static final String PATH_ALIAS = "path_alias";

    // Category records
    public static final String NAME = "name";
    public static final String SORT_NAME = "sort_name";
    public static final String DESCRIPTION = "description";

    private IndexFields() {
    }
}
