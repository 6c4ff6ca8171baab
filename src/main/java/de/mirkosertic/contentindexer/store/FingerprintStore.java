package de.mirkosertic.contentindexer.store;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted mapping of file path to content fingerprint and modification time, plus the
 * housekeeping that keeps every record kind in step with the files on disk.
 * <p>
 * Writes are idempotent upserts wrapped in {@link StoreRetry}. Pruning runs in two phases:
 * candidate paths are collected from a searcher snapshot first, then each one is checked again
 * right before its deletion so that a file reappearing in between keeps its records.
 */
public class FingerprintStore {

    private static final Logger logger = LoggerFactory.getLogger(FingerprintStore.class);

    private static final Sort NEWEST_FIRST = new Sort(new SortField(IndexFields.FILE_MTIME, SortField.Type.LONG, true));

    private final MetadataIndexService index;
    private final StoreRetry retry;

    public FingerprintStore(final MetadataIndexService index, final StoreRetry retry) {
        this.index = index;
        this.retry = retry;
    }

    public Optional<String> get(final Path file) throws IOException {
        return find(file).map(FingerprintRecord::fingerprint);
    }

    public Optional<FingerprintRecord> find(final Path file) throws IOException {
        return index.findByRecordId(recordId(file)).map(FingerprintStore::toRecord);
    }

    /**
     * Fingerprint the file as it is now and store the result. If the file is gone, its record
     * is removed instead.
     *
     * @return true if the store was changed
     */
    public boolean set(final Path file) throws IOException {
        try {
            final String fingerprint = Fingerprints.of(file);
            final long mtime = Files.getLastModifiedTime(file).toMillis();
            return set(file, fingerprint, mtime);
        } catch (final NoSuchFileException e) {
            logger.debug("{} vanished before it could be fingerprinted", file);
            return delete(file);
        }
    }

    /**
     * Upsert a fingerprint. Nothing is written when the stored fingerprint is already equal.
     *
     * @return true if the store was changed
     */
    public boolean set(final Path file, final String fingerprint, final long mtime) throws IOException {
        Objects.requireNonNull(fingerprint, "fingerprint");
        return retry.execute("Set fingerprint of " + file, () -> {
            final Optional<FingerprintRecord> existing = find(file);
            if (existing.isPresent() && existing.get().fingerprint().equals(fingerprint)) {
                return false;
            }
            index.upsert(recordId(file), toDocument(file.toString(), fingerprint, mtime));
            logger.debug("{}: {} -> {}", file, existing.map(FingerprintRecord::fingerprint).orElse(null), fingerprint);
            return true;
        });
    }

    /**
     * @return true if a record existed
     */
    public boolean delete(final Path file) throws IOException {
        return retry.execute("Delete fingerprint of " + file, () -> {
            if (index.findByRecordId(recordId(file)).isEmpty()) {
                return false;
            }
            index.deleteRecord(recordId(file));
            return true;
        });
    }

    /**
     * Remove the records of every kind that were derived from the given file.
     */
    public void forget(final Path file) throws IOException {
        retry.execute("Forget " + file, () -> {
            index.delete(new TermQuery(new Term(IndexFields.FILE_PATH, file.toString())));
            return null;
        });
        logger.debug("Forgot all records of {}", file);
    }

    /**
     * Delete records of the given kind whose file no longer exists.
     *
     * @return number of paths whose records were removed
     */
    public int pruneMissing(final RecordKind kind) {
        logger.debug("Pruning missing {} files", kind.fieldValue());

        final List<String> removedPaths = new ArrayList<>();
        try {
            for (final String filePath : index.listFilePaths(kind)) {
                if (!Files.isRegularFile(Paths.get(filePath))) {
                    logger.info("{} disappeared: {}", kind.fieldValue(), filePath);
                    removedPaths.add(filePath);
                }
            }
        } catch (final IOException e) {
            logger.error("Error collecting {} records to prune", kind.fieldValue(), e);
            return 0;
        }

        int pruned = 0;
        for (final String filePath : removedPaths) {
            try {
                if (pruneIfStillMissing(kind, filePath)) {
                    pruned++;
                }
            } catch (final IOException e) {
                logger.error("Error pruning {} {}", kind.fieldValue(), filePath, e);
            }
        }
        return pruned;
    }

    private boolean pruneIfStillMissing(final RecordKind kind, final String filePath) throws IOException {
        return retry.execute("Prune " + kind.fieldValue() + " " + filePath, () -> {
            if (Files.isRegularFile(Paths.get(filePath))) {
                logger.debug("{} reappeared, keeping its {} records", filePath, kind.fieldValue());
                return false;
            }
            logger.debug("Pruning {} {}", kind.fieldValue(), filePath);
            index.delete(pathOfKind(kind, filePath));
            return true;
        });
    }

    /**
     * The most recently modified file known to the store, usable as a cache invalidation key.
     */
    public Optional<FingerprintRecord> lastModified() throws IOException {
        return index.findFirst(MetadataIndexService.kindQuery(RecordKind.FINGERPRINT), NEWEST_FIRST)
                .map(FingerprintStore::toRecord);
    }

    public int count() throws IOException {
        return index.count(RecordKind.FINGERPRINT);
    }

    public void commit() throws IOException {
        retry.execute("Commit metadata index", () -> {
            index.commit();
            return null;
        });
    }

    private static String recordId(final Path file) {
        return RecordKind.FINGERPRINT.recordId(file.toString());
    }

    private static Query pathOfKind(final RecordKind kind, final String filePath) {
        return new BooleanQuery.Builder()
                .add(MetadataIndexService.kindQuery(kind), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(IndexFields.FILE_PATH, filePath)), BooleanClause.Occur.FILTER)
                .build();
    }

    private static Document toDocument(final String filePath, final String fingerprint, final long mtime) {
        final Document doc = new Document();
        doc.add(new StringField(IndexFields.RECORD_ID, RecordKind.FINGERPRINT.recordId(filePath), Field.Store.YES));
        doc.add(new StringField(IndexFields.KIND, RecordKind.FINGERPRINT.fieldValue(), Field.Store.YES));
        doc.add(new StringField(IndexFields.FILE_PATH, filePath, Field.Store.YES));
        doc.add(new StringField(IndexFields.FINGERPRINT, fingerprint, Field.Store.YES));
        doc.add(new LongPoint(IndexFields.FILE_MTIME, mtime));
        doc.add(new StoredField(IndexFields.FILE_MTIME, mtime));
        doc.add(new NumericDocValuesField(IndexFields.FILE_MTIME, mtime));
        return doc;
    }

    private static FingerprintRecord toRecord(final Document doc) {
        final IndexableField mtime = doc.getField(IndexFields.FILE_MTIME);
        return new FingerprintRecord(
                doc.get(IndexFields.FILE_PATH),
                doc.get(IndexFields.FINGERPRINT),
                mtime != null ? mtime.numericValue().longValue() : 0L);
    }
}
