package de.mirkosertic.contentindexer.store;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lucene index holding every metadata record of the content tree.
 * <p>
 * Records are addressed by their {@link IndexFields#RECORD_ID} term, so writes are upserts.
 * Readers go through a {@link SearcherManager}; a write marks the searcher stale and the next
 * read refreshes it, so the indexing worker always reads its own writes. A background thread
 * additionally refreshes at the configured NRT interval for readers outside the worker.
 */
public class MetadataIndexService {

    private static final Logger logger = LoggerFactory.getLogger(MetadataIndexService.class);

    private final String indexPath;
    private final long nrtRefreshIntervalMs;
    private final AtomicBoolean stale = new AtomicBoolean(false);

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService refreshScheduler;
    private volatile int indexSchemaVersion;
    private volatile boolean schemaUpgradeRequired;

    public MetadataIndexService(final String indexPath, final long nrtRefreshIntervalMs) {
        this.indexPath = indexPath;
        this.nrtRefreshIntervalMs = nrtRefreshIntervalMs;
    }

    /**
     * Open or create the index. Must be called before using the service.
     */
    public void init() throws IOException {
        final Path path = Path.of(indexPath);
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created index directory: {}", path.toAbsolutePath());
        }

        directory = FSDirectory.open(path);
        indexSchemaVersion = readStoredSchemaVersion();
        schemaUpgradeRequired = indexSchemaVersion != IndexFields.SCHEMA_VERSION;

        final IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);
        indexWriter.setLiveCommitData(schemaCommitData(indexSchemaVersion));
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "metadata-nrt-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        if (schemaUpgradeRequired) {
            logger.warn("Index schema version {} differs from current version {}",
                    indexSchemaVersion, IndexFields.SCHEMA_VERSION);
        }
        logger.info("Metadata index initialized at: {} (schema version {})", path.toAbsolutePath(), indexSchemaVersion);
    }

    private int readStoredSchemaVersion() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return IndexFields.SCHEMA_VERSION;
        }
        final Map<String, String> userData = SegmentInfos.readLatestCommit(directory).getUserData();
        final String version = userData.get(IndexFields.SCHEMA_VERSION_KEY);
        if (version == null) {
            return 0;
        }
        try {
            return Integer.parseInt(version);
        } catch (final NumberFormatException e) {
            logger.warn("Unreadable schema version '{}' in index commit data", version);
            return 0;
        }
    }

    private static Set<Map.Entry<String, String>> schemaCommitData(final int version) {
        return Map.of(IndexFields.SCHEMA_VERSION_KEY, String.valueOf(version)).entrySet();
    }

    private void maybeRefreshSearcher() {
        try {
            searcherManager.maybeRefresh();
        } catch (final IOException e) {
            logger.warn("Failed to refresh SearcherManager", e);
        }
    }

    /**
     * Close the index service and release all resources. Pending changes are committed.
     */
    public void close() throws IOException {
        if (refreshScheduler != null) {
            refreshScheduler.shutdown();
            try {
                if (!refreshScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    refreshScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                refreshScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Metadata index closed");
    }

    public boolean isSchemaUpgradeRequired() {
        return schemaUpgradeRequired;
    }

    public int getIndexSchemaVersion() {
        return indexSchemaVersion;
    }

    /**
     * Drop every record and stamp the index with the current schema version.
     *
     * @return number of records removed
     */
    public synchronized long purgeAll() throws IOException {
        final long removed = indexWriter.getDocStats().numDocs;
        indexWriter.deleteAll();
        indexWriter.setLiveCommitData(schemaCommitData(IndexFields.SCHEMA_VERSION));
        indexWriter.commit();
        stale.set(true);
        indexSchemaVersion = IndexFields.SCHEMA_VERSION;
        schemaUpgradeRequired = false;
        logger.info("Purged {} records from metadata index", removed);
        return removed;
    }

    public void upsert(final String recordId, final Document document) throws IOException {
        indexWriter.updateDocument(new Term(IndexFields.RECORD_ID, recordId), document);
        stale.set(true);
    }

    public void deleteRecord(final String recordId) throws IOException {
        indexWriter.deleteDocuments(new Term(IndexFields.RECORD_ID, recordId));
        stale.set(true);
    }

    public void delete(final Query query) throws IOException {
        indexWriter.deleteDocuments(query);
        stale.set(true);
    }

    public void commit() throws IOException {
        indexWriter.commit();
    }

    public Optional<Document> findByRecordId(final String recordId) throws IOException {
        return findFirst(new TermQuery(new Term(IndexFields.RECORD_ID, recordId)), null);
    }

    /**
     * First match of the query, in sort order if a sort is given.
     */
    public Optional<Document> findFirst(final Query query, @Nullable final Sort sort) throws IOException {
        final IndexSearcher searcher = acquire();
        try {
            final TopDocs topDocs = sort == null ? searcher.search(query, 1) : searcher.search(query, 1, sort);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    public List<Document> findAll(final Query query) throws IOException {
        final IndexSearcher searcher = acquire();
        try {
            final int count = searcher.count(query);
            if (count == 0) {
                return List.of();
            }
            final List<Document> result = new ArrayList<>(count);
            for (final ScoreDoc scoreDoc : searcher.search(query, count).scoreDocs) {
                result.add(searcher.storedFields().document(scoreDoc.doc));
            }
            return result;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Distinct file paths of all records of the given kind.
     */
    public Set<String> listFilePaths(final RecordKind kind) throws IOException {
        final Set<String> paths = new LinkedHashSet<>();
        for (final Document document : findAll(kindQuery(kind))) {
            final String path = document.get(IndexFields.FILE_PATH);
            if (path != null) {
                paths.add(path);
            }
        }
        return paths;
    }

    public int count(final RecordKind kind) throws IOException {
        final IndexSearcher searcher = acquire();
        try {
            return searcher.count(kindQuery(kind));
        } finally {
            searcherManager.release(searcher);
        }
    }

    public static Query kindQuery(final RecordKind kind) {
        return new TermQuery(new Term(IndexFields.KIND, kind.fieldValue()));
    }

    private IndexSearcher acquire() throws IOException {
        if (stale.compareAndSet(true, false)) {
            searcherManager.maybeRefreshBlocking();
        }
        return searcherManager.acquire();
    }
}
