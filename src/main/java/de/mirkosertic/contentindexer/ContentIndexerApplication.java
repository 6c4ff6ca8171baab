package de.mirkosertic.contentindexer;

import de.mirkosertic.contentindexer.config.ApplicationConfig;
import de.mirkosertic.contentindexer.config.BuildInfo;
import de.mirkosertic.contentindexer.config.LoggingConfigurator;
import de.mirkosertic.contentindexer.indexer.ContentWatchListener;
import de.mirkosertic.contentindexer.indexer.DirectoryWatcherService;
import de.mirkosertic.contentindexer.indexer.IndexExecutorService;
import de.mirkosertic.contentindexer.indexer.IndexScheduler;
import de.mirkosertic.contentindexer.indexer.IndexState;
import de.mirkosertic.contentindexer.indexer.IndexStateManager;
import de.mirkosertic.contentindexer.indexer.IndexStatisticsTracker;
import de.mirkosertic.contentindexer.indexer.TreeScanner;
import de.mirkosertic.contentindexer.scan.ScanDispatcher;
import de.mirkosertic.contentindexer.store.FingerprintStore;
import de.mirkosertic.contentindexer.store.MetadataIndexService;
import de.mirkosertic.contentindexer.store.RecordKind;
import de.mirkosertic.contentindexer.store.StoreRetry;
import org.apache.lucene.store.LockObtainFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Main entry point of the content indexer.
 * <p>
 * Usage: {@code ContentIndexerApplication [watch|scan|status]}. {@code watch} (the default)
 * scans the content tree and then follows file changes until the process is stopped,
 * {@code scan} scans once and prints the resulting status, {@code status} prints the status
 * of the existing index.
 */
public class ContentIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(ContentIndexerApplication.class);

    private static final long STORE_RETRY_BACKOFF_MS = 50;
    private static final Duration SCAN_TIMEOUT = Duration.ofHours(1);

    enum Mode {
        WATCH,
        SCAN,
        STATUS;

        static Mode fromArgs(final String[] args) {
            if (args.length == 0) {
                return WATCH;
            }
            try {
                return valueOf(args[0].toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown command '" + args[0] + "', expected watch, scan or status", e);
            }
        }
    }

    private final ApplicationConfig config;
    private final Path contentDir;
    private final MetadataIndexService indexService;
    private final FingerprintStore fingerprintStore;
    private final ScanDispatcher dispatcher;
    private final IndexStatisticsTracker statisticsTracker;
    private final IndexExecutorService indexExecutor;
    private final IndexScheduler scheduler;
    private final TreeScanner treeScanner;
    private final DirectoryWatcherService watcherService;
    private final IndexStateManager stateManager;
    private volatile boolean indexOpen;

    public ContentIndexerApplication(final ApplicationConfig config) {
        this(config, new IndexStateManager());
    }

    ContentIndexerApplication(final ApplicationConfig config, final IndexStateManager stateManager) {
        this.config = config;
        this.contentDir = config.getContentDirectory().toAbsolutePath().normalize();
        this.stateManager = stateManager;

        this.indexService = new MetadataIndexService(config.getIndexPath(), config.getNrtRefreshIntervalMs());
        this.fingerprintStore = new FingerprintStore(indexService,
                new StoreRetry(config.getStoreRetryAttempts(), STORE_RETRY_BACKOFF_MS));
        this.dispatcher = ScanDispatcher.create(config, indexService);
        this.statisticsTracker = new IndexStatisticsTracker();
        this.indexExecutor = new IndexExecutorService();
        this.scheduler = new IndexScheduler(indexExecutor, dispatcher, fingerprintStore, statisticsTracker,
                config.getWaitTime());
        this.treeScanner = new TreeScanner(indexExecutor, scheduler, dispatcher, fingerprintStore, statisticsTracker);
        this.watcherService = new DirectoryWatcherService(config.getWatchPollIntervalMs());
    }

    /**
     * Open the index. An index written with another schema version is emptied and
     * rebuilt by the next scan.
     *
     * @return true if the index has to be rebuilt
     */
    public boolean init() throws IOException {
        openIndex();

        if (indexService.isSchemaUpgradeRequired()) {
            logger.warn("Schema version changed, purging index for a full rebuild");
            indexService.purgeAll();
            return true;
        }
        return false;
    }

    private void openIndex() throws IOException {
        logger.info("Initializing content indexer {} for {}", BuildInfo.current().version(), contentDir);

        if (!Files.isDirectory(contentDir)) {
            throw new IOException("Content directory does not exist: " + contentDir);
        }

        indexService.init();
        indexOpen = true;
    }

    /**
     * Walk the content tree and queue every changed file. The index state is saved once the
     * worker has compared all files.
     */
    public void scan() throws IOException {
        treeScanner.scanIndex(contentDir);
        indexExecutor.execute(this::saveIndexState);
    }

    public void watch() throws IOException {
        watcherService.watchDirectory(contentDir, new ContentWatchListener(contentDir, scheduler));
        logger.info("Watching {} for changes", contentDir);
    }

    /**
     * Wait for the worker to process everything queued so far.
     */
    public boolean awaitIdle(final Duration timeout) throws InterruptedException {
        return scheduler.awaitIdle(timeout);
    }

    private void saveIndexState() {
        try {
            stateManager.save(new IndexState(
                    System.currentTimeMillis(),
                    fingerprintStore.count(),
                    indexService.getIndexSchemaVersion(),
                    contentDir.toString()));
        } catch (final IOException e) {
            logger.error("Failed to save index state", e);
        }
    }

    public IndexerStatus status() {
        final BuildInfo buildInfo = BuildInfo.current();
        final IndexState lastScan = stateManager.load().orElse(null);
        if (!indexOpen) {
            return new IndexerStatus(buildInfo.version(), contentDir.toString(), config.getIndexPath(),
                    null, null, null, null, null, null, null, lastScan);
        }

        final OptionalInt queueDepth = scheduler.queueDepth();
        try {
            return new IndexerStatus(
                    buildInfo.version(),
                    contentDir.toString(),
                    config.getIndexPath(),
                    indexService.getIndexSchemaVersion(),
                    queueDepth.isPresent() ? queueDepth.getAsInt() : null,
                    fingerprintStore.count(),
                    indexService.count(RecordKind.ENTRY),
                    indexService.count(RecordKind.CATEGORY),
                    fingerprintStore.lastModified().orElse(null),
                    statisticsTracker.getStatistics(),
                    lastScan);
        } catch (final IOException e) {
            logger.warn("Cannot read index statistics", e);
            return new IndexerStatus(buildInfo.version(), contentDir.toString(), config.getIndexPath(),
                    indexService.getIndexSchemaVersion(), null, null, null, null, null,
                    statisticsTracker.getStatistics(), lastScan);
        }
    }

    void run(final Mode mode) throws IOException, InterruptedException {
        switch (mode) {
            case STATUS -> {
                try {
                    openIndex();
                } catch (final LockObtainFailedException e) {
                    logger.warn("Index is in use by a running indexer, reporting saved state only");
                }
                System.out.println(status().toJson());
            }
            case SCAN -> {
                init();
                scan();
                if (!awaitIdle(SCAN_TIMEOUT)) {
                    logger.warn("Indexing did not finish within {}", SCAN_TIMEOUT);
                }
                System.out.println(status().toJson());
            }
            case WATCH -> {
                final boolean rebuild = init();
                Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
                if (rebuild || config.isScanOnStartup()) {
                    scan();
                }
                if (config.isWatchEnabled()) {
                    watch();
                }
                try {
                    Thread.currentThread().join();
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.info("Main thread interrupted, shutting down...");
                }
            }
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down content indexer...");

        try {
            watcherService.stopAll();
        } catch (final Exception e) {
            logger.error("Error stopping directory watcher", e);
        }

        try {
            scheduler.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down index scheduler", e);
        }

        if (indexOpen) {
            try {
                indexService.close();
                indexOpen = false;
            } catch (final Exception e) {
                logger.error("Error closing metadata index", e);
            }
        }

        logger.info("Content indexer shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = ApplicationConfig.isDeployedProfile();
            LoggingConfigurator.configure(deployedMode);

            final Mode mode = Mode.fromArgs(args);
            final ApplicationConfig config = ApplicationConfig.load();

            final ContentIndexerApplication app = new ContentIndexerApplication(config);
            try {
                app.run(mode);
            } finally {
                if (mode != Mode.WATCH) {
                    app.shutdown();
                }
            }
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Content indexer failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
