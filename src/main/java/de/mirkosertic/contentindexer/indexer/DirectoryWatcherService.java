package de.mirkosertic.contentindexer.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches a directory tree and reports file changes to a {@link FileChangeListener}.
 * Directories created later are registered as they appear; files already inside them are
 * reported as created.
 */
public class DirectoryWatcherService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    private final long watchPollIntervalMs;
    private final Map<WatchKey, WatchInfo> watchKeys = new ConcurrentHashMap<>();
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;

    public DirectoryWatcherService(final long watchPollIntervalMs) {
        this.watchPollIntervalMs = watchPollIntervalMs;
    }

    public synchronized void watchDirectory(final Path directory, final FileChangeListener listener) throws IOException {
        final boolean startLoop = watchService == null;
        if (startLoop) {
            watchService = FileSystems.getDefault().newWatchService();
        }

        registerRecursive(directory, listener, false);

        if (startLoop) {
            watchExecutor.execute(this::processEvents);
        }
    }

    private void registerRecursive(final Path directory, final FileChangeListener listener,
                                   final boolean reportFiles) throws IOException {
        Files.walkFileTree(directory, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                        final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                        watchKeys.put(key, new WatchInfo(dir, listener));
                        logger.debug("Registered watch for directory: {}", dir);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                        // Files written into a new directory before its watch was registered
                        if (reportFiles && attrs.isRegularFile()) {
                            listener.onFileCreated(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                        logger.warn("Cannot watch {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(watchPollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final WatchInfo watchInfo = watchKeys.get(key);
            if (watchInfo == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow in {}, changes may have been missed until the next scan",
                            watchInfo.directory());
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = watchInfo.directory().resolve(pathEvent.context());

                try {
                    if (kind == ENTRY_CREATE) {
                        if (Files.isDirectory(fullPath)) {
                            registerRecursive(fullPath, watchInfo.listener(), true);
                        } else if (Files.isRegularFile(fullPath)) {
                            watchInfo.listener().onFileCreated(fullPath);
                        }
                    } else if (kind == ENTRY_MODIFY) {
                        if (Files.isRegularFile(fullPath)) {
                            watchInfo.listener().onFileModified(fullPath);
                        }
                    } else if (kind == ENTRY_DELETE) {
                        watchInfo.listener().onFileDeleted(fullPath);
                    }
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            final boolean valid = key.reset();
            if (!valid) {
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid, removed from tracking", watchInfo.directory());
            }
        }

        logger.info("Directory watcher stopped");
    }

    public synchronized void stopAll() throws IOException {
        logger.info("Stopping all directory watchers");
        watchExecutor.shutdownNow();

        if (watchService != null) {
            watchService.close();
        }

        watchKeys.clear();
    }

    private record WatchInfo(Path directory, FileChangeListener listener) {
    }
}
