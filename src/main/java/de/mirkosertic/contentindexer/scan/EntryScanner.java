package de.mirkosertic.contentindexer.scan;

import de.mirkosertic.contentindexer.store.IndexFields;
import de.mirkosertic.contentindexer.store.MetadataIndexService;
import de.mirkosertic.contentindexer.store.RecordKind;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Indexes posts (Markdown or HTML files with a header block).
 * <p>
 * An entry is identified by its {@code Entry-ID} header. Without one the scan fails unless
 * fixup mode is on, in which case an id is assigned, together with {@code Date} and
 * {@code UUID} when those are missing, and the file is rewritten in place.
 */
public class EntryScanner implements ContentScanner {

    private static final Logger logger = LoggerFactory.getLogger(EntryScanner.class);

    static final String HEADER_ENTRY_ID = "Entry-ID";
    static final String HEADER_DATE = "Date";
    static final String HEADER_UUID = "UUID";
    private static final String HEADER_TITLE = "Title";
    private static final String HEADER_CATEGORY = "Category";
    private static final String HEADER_STATUS = "Status";
    private static final String HEADER_TYPE = "Type";
    private static final String HEADER_ENTRY_TYPE = "Entry-Type";
    private static final String HEADER_SLUG_TEXT = "Slug-Text";
    private static final String HEADER_REDIRECT_TO = "Redirect-To";
    private static final String HEADER_PATH_ALIAS = "Path-Alias";

    private static final Pattern SPACE_SEPARATED_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d.*");
    private static final Sort HIGHEST_ID_FIRST = new Sort(new SortField(IndexFields.ENTRY_ID, SortField.Type.LONG, true));

    public enum PublishStatus {
        DRAFT,
        HIDDEN,
        PUBLISHED,
        SCHEDULED,
        GONE
    }

    public enum EntryType {
        ENTRY,
        NOTE
    }

    private final MetadataIndexService index;
    private final ZoneId zone;

    public EntryScanner(final MetadataIndexService index, final ZoneId zone) {
        this.index = index;
        this.zone = zone;
    }

    @Override
    public ScanResult scan(final Path fullPath, @Nullable final String relativePath, final boolean fixup) throws IOException {
        if (Files.size(fullPath) == 0) {
            logger.debug("Skipping empty entry file: {}", fullPath);
            return ScanResult.notApplicable();
        }

        final HeaderDocument entry = HeaderDocument.read(fullPath);

        final Optional<String> entryIdHeader = entry.get(HEADER_ENTRY_ID);
        if (entryIdHeader.isEmpty() && !fixup) {
            logger.info("{} has no {} header", fullPath, HEADER_ENTRY_ID);
            return ScanResult.failed();
        }

        final boolean fixupNeeded = entryIdHeader.isEmpty() || !entry.has(HEADER_DATE) || !entry.has(HEADER_UUID);

        final String relativeName = ContentNames.relativeName(fullPath, relativePath);
        final String title = entry.get(HEADER_TITLE)
                .orElseGet(() -> ContentNames.guessTitle(ContentNames.baseName(relativeName)));
        final String category = entry.get(HEADER_CATEGORY).orElseGet(() -> ContentNames.categoryOf(relativeName));
        final PublishStatus status = PublishStatus.valueOf(
                entry.get(HEADER_STATUS).orElse(PublishStatus.SCHEDULED.name()).toUpperCase(Locale.ROOT));
        final EntryType entryType = EntryType.valueOf(
                entry.get(HEADER_TYPE)
                        .or(() -> entry.get(HEADER_ENTRY_TYPE))
                        .orElse(EntryType.ENTRY.name())
                        .toUpperCase(Locale.ROOT));
        final String slug = ContentNames.makeSlug(entry.get(HEADER_SLUG_TEXT).orElse(title));

        final ZonedDateTime entryDate;
        if (entry.has(HEADER_DATE)) {
            entryDate = parseDate(entry.get(HEADER_DATE).orElseThrow());
        } else {
            entryDate = Files.getLastModifiedTime(fullPath).toInstant().atZone(zone).truncatedTo(ChronoUnit.SECONDS);
            entry.set(HEADER_DATE, entryDate.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        }

        final long entryId;
        if (entryIdHeader.isPresent()) {
            entryId = Long.parseLong(entryIdHeader.get().trim());
        } else {
            final Optional<Long> existing = existingEntryId(fullPath);
            entryId = existing.isPresent() ? existing.get() : nextEntryId();
        }

        if (!entry.has(HEADER_UUID)) {
            entry.set(HEADER_UUID, UUID.randomUUID().toString());
        }

        final String recordId = RecordKind.ENTRY.recordId(String.valueOf(entryId));

        // A file that changed its Entry-ID leaves its previous record behind
        index.delete(new BooleanQuery.Builder()
                .add(pathQuery(fullPath), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(IndexFields.RECORD_ID, recordId)), BooleanClause.Occur.MUST_NOT)
                .build());

        final Document doc = new Document();
        doc.add(new StringField(IndexFields.RECORD_ID, recordId, Field.Store.YES));
        doc.add(new StringField(IndexFields.KIND, RecordKind.ENTRY.fieldValue(), Field.Store.YES));
        doc.add(new StringField(IndexFields.FILE_PATH, fullPath.toString(), Field.Store.YES));
        doc.add(new LongPoint(IndexFields.ENTRY_ID, entryId));
        doc.add(new StoredField(IndexFields.ENTRY_ID, entryId));
        doc.add(new NumericDocValuesField(IndexFields.ENTRY_ID, entryId));
        doc.add(new StringField(IndexFields.UUID, entry.get(HEADER_UUID).orElseThrow(), Field.Store.YES));
        doc.add(new TextField(IndexFields.TITLE, title, Field.Store.YES));
        doc.add(new StringField(IndexFields.SLUG_TEXT, slug, Field.Store.YES));
        doc.add(new StringField(IndexFields.CATEGORY, category, Field.Store.YES));
        doc.add(new StringField(IndexFields.STATUS, status.name(), Field.Store.YES));
        doc.add(new StringField(IndexFields.ENTRY_TYPE, entryType.name(), Field.Store.YES));
        final long entryDateMillis = entryDate.toInstant().toEpochMilli();
        doc.add(new LongPoint(IndexFields.ENTRY_DATE, entryDateMillis));
        doc.add(new StoredField(IndexFields.ENTRY_DATE, entryDateMillis));
        entry.get(HEADER_REDIRECT_TO)
                .ifPresent(url -> doc.add(new StoredField(IndexFields.REDIRECT_URL, url)));
        for (final String alias : entry.getAll(HEADER_PATH_ALIAS)) {
            doc.add(new StringField(IndexFields.PATH_ALIAS, alias, Field.Store.YES));
        }
        index.upsert(recordId, doc);

        if (fixupNeeded) {
            entry.set(HEADER_ENTRY_ID, String.valueOf(entryId));
            entry.writeAtomically(fullPath);
            logger.info("Fixed up headers of {} (entry {})", fullPath, entryId);
        }

        return ScanResult.indexed(recordId);
    }

    ZonedDateTime parseDate(final String value) {
        final String text = SPACE_SEPARATED_DATE_TIME.matcher(value).matches()
                ? value.replaceFirst(" ", "T")
                : value;
        try {
            return OffsetDateTime.parse(text).toZonedDateTime();
        } catch (final DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return ZonedDateTime.parse(text);
        } catch (final DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(text).atZone(zone);
        } catch (final DateTimeParseException ignored) {
            // try the next format
        }
        return LocalDate.parse(text).atStartOfDay(zone);
    }

    private Optional<Long> existingEntryId(final Path fullPath) throws IOException {
        return index.findFirst(pathQuery(fullPath), null)
                .map(doc -> doc.getField(IndexFields.ENTRY_ID))
                .map(field -> field.numericValue().longValue());
    }

    private long nextEntryId() throws IOException {
        return index.findFirst(MetadataIndexService.kindQuery(RecordKind.ENTRY), HIGHEST_ID_FIRST)
                .map(doc -> doc.getField(IndexFields.ENTRY_ID).numericValue().longValue() + 1)
                .orElse(1L);
    }

    private static Query pathQuery(final Path fullPath) {
        return new BooleanQuery.Builder()
                .add(MetadataIndexService.kindQuery(RecordKind.ENTRY), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(IndexFields.FILE_PATH, fullPath.toString())), BooleanClause.Occur.FILTER)
                .build();
    }
}
