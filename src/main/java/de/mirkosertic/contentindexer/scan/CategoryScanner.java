package de.mirkosertic.contentindexer.scan;

import de.mirkosertic.contentindexer.store.IndexFields;
import de.mirkosertic.contentindexer.store.MetadataIndexService;
import de.mirkosertic.contentindexer.store.RecordKind;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Indexes category metadata files. The category is the directory holding the file.
 */
public class CategoryScanner implements ContentScanner {

    private static final Logger logger = LoggerFactory.getLogger(CategoryScanner.class);

    private static final String HEADER_NAME = "Name";
    private static final String HEADER_SORT_NAME = "Sort-Name";
    private static final String HEADER_DESCRIPTION = "Description";

    private final MetadataIndexService index;

    public CategoryScanner(final MetadataIndexService index) {
        this.index = index;
    }

    @Override
    public ScanResult scan(final Path fullPath, @Nullable final String relativePath, final boolean fixup) throws IOException {
        final HeaderDocument meta = HeaderDocument.read(fullPath);
        final String category = ContentNames.categoryOf(ContentNames.relativeName(fullPath, relativePath));

        final String name = meta.get(HEADER_NAME)
                .orElseGet(() -> ContentNames.guessTitle(ContentNames.baseName(category)));
        final String sortName = meta.get(HEADER_SORT_NAME).orElse(name.toLowerCase(Locale.ROOT));

        final String recordId = RecordKind.CATEGORY.recordId(category);
        final Document doc = new Document();
        doc.add(new StringField(IndexFields.RECORD_ID, recordId, Field.Store.YES));
        doc.add(new StringField(IndexFields.KIND, RecordKind.CATEGORY.fieldValue(), Field.Store.YES));
        doc.add(new StringField(IndexFields.FILE_PATH, fullPath.toString(), Field.Store.YES));
        doc.add(new StringField(IndexFields.CATEGORY, category, Field.Store.YES));
        doc.add(new StringField(IndexFields.NAME, name, Field.Store.YES));
        doc.add(new StringField(IndexFields.SORT_NAME, sortName, Field.Store.YES));
        meta.get(HEADER_DESCRIPTION)
                .ifPresent(description -> doc.add(new StoredField(IndexFields.DESCRIPTION, description)));
        index.upsert(recordId, doc);

        logger.debug("Indexed category '{}' from {}", category, fullPath);
        return ScanResult.indexed(recordId);
    }
}
