package de.mirkosertic.contentindexer.indexer;

import de.mirkosertic.contentindexer.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads and saves {@link IndexState} as YAML.
 */
public class IndexStateManager {

    private static final Logger logger = LoggerFactory.getLogger(IndexStateManager.class);
    private static final String STATE_FILE = "index-state.yaml";

    private final Path statePath;
    private final Yaml yaml;

    public IndexStateManager() {
        this(ApplicationConfig.getConfigDirectory().resolve(STATE_FILE));
    }

    public IndexStateManager(final Path statePath) {
        this.statePath = statePath;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * @return the saved state, empty if the file does not exist or cannot be parsed
     */
    public synchronized Optional<IndexState> load() {
        if (!Files.exists(statePath)) {
            logger.debug("Index state file does not exist: {}", statePath);
            return Optional.empty();
        }

        try (final Reader reader = Files.newBufferedReader(statePath)) {
            final Map<String, Object> stateMap = yaml.load(reader);
            if (stateMap == null) {
                logger.debug("Index state file is empty: {}", statePath);
                return Optional.empty();
            }

            final long lastScanTimeMs = ((Number) stateMap.getOrDefault("lastScanTimeMs", 0L)).longValue();
            final long lastFingerprintCount = ((Number) stateMap.getOrDefault("lastFingerprintCount", 0L)).longValue();
            final int schemaVersion = ((Number) stateMap.getOrDefault("schemaVersion", 0)).intValue();
            final String contentDirectory = (String) stateMap.getOrDefault("contentDirectory", "");

            return Optional.of(new IndexState(lastScanTimeMs, lastFingerprintCount, schemaVersion, contentDirectory));
        } catch (final IOException e) {
            logger.error("Failed to load index state file: {}", statePath, e);
            return Optional.empty();
        } catch (final ClassCastException e) {
            logger.error("Invalid index state structure in: {}", statePath, e);
            return Optional.empty();
        }
    }

    public synchronized void save(final IndexState state) throws IOException {
        final Path directory = statePath.toAbsolutePath().getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }

        final Map<String, Object> stateMap = new LinkedHashMap<>();
        stateMap.put("lastScanTimeMs", state.lastScanTimeMs());
        stateMap.put("lastFingerprintCount", state.lastFingerprintCount());
        stateMap.put("schemaVersion", state.schemaVersion());
        stateMap.put("contentDirectory", state.contentDirectory());

        try (final Writer writer = Files.newBufferedWriter(statePath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(stateMap, writer);
        }
        logger.info("Saved index state: scanTime={}, fingerprints={}, schema={}",
                state.lastScanTimeMs(), state.lastFingerprintCount(), state.schemaVersion());
    }

    public Path getStatePath() {
        return statePath;
    }
}
