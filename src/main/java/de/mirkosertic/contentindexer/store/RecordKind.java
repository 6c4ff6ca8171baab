package de.mirkosertic.contentindexer.store;

import java.util.Locale;

/**
 * Kinds of records held in the metadata index. Every record carries its kind and the
 * path of the file it was derived from.
 */
public enum RecordKind {
    ENTRY,
    CATEGORY,
    /** Written by image rendition collaborators, only pruned here. */
    IMAGE,
    FINGERPRINT;

    public String fieldValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unique id of a record of this kind, used as the update term in the index.
     */
    public String recordId(final String key) {
        return fieldValue() + ":" + key;
    }
}
