package de.mirkosertic.contentindexer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the content indexer.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.contentindexer/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CONTENT_DIR = "CONTENT_INDEXER_CONTENT_DIR";
    private static final String ENV_INDEX_PATH = "CONTENT_INDEXER_INDEX_PATH";
    private static final String ENV_WAIT_TIME_MS = "CONTENT_INDEXER_WAIT_TIME_MS";
    private static final String PROP_CONTENT_DIR = "contentindexer.content.dir";
    private static final String PROP_INDEX_PATH = "contentindexer.index.path";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".contentindexer";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Content settings
    private String contentDirectory = "content";

    // Index settings
    private String indexPath;
    private long nrtRefreshIntervalMs = 100;

    // Indexer settings
    private long waitTimeMs = 1000;
    private boolean watchEnabled = true;
    private boolean scanOnStartup = true;
    private long watchPollIntervalMs = 2000;
    private int storeRetryAttempts = 5;
    private List<String> entryExtensions = List.of(".md", ".htm", ".html");
    private List<String> categoryExtensions = List.of(".cat", ".meta");
    private String timezone = "UTC";

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();
        config.validate();

        logger.info("Configuration loaded: contentDirectory={}, indexPath={}, waitTimeMs={}, deployedMode={}",
                config.contentDirectory, config.indexPath, config.waitTimeMs, config.deployedMode);

        return config;
    }

    /**
     * Built-in defaults only, without consulting any file, environment variable or system property.
     *
     * @param contentDirectory the content tree to index
     * @param indexPath        the directory holding the metadata index
     */
    public static ApplicationConfig defaults(final Path contentDirectory, final Path indexPath) {
        final ApplicationConfig config = new ApplicationConfig();
        config.contentDirectory = contentDirectory.toString();
        config.indexPath = indexPath.toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("contentindexer");
        if (root == null) {
            return;
        }

        final Map<String, Object> contentConfig = (Map<String, Object>) root.get("content");
        if (contentConfig != null && contentConfig.get("directory") != null) {
            this.contentDirectory = resolveVariables(contentConfig.get("directory").toString());
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            final Object path = indexConfig.get("path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
            if (indexConfig.containsKey("nrt-refresh-interval-ms")) {
                this.nrtRefreshIntervalMs = ((Number) indexConfig.get("nrt-refresh-interval-ms")).longValue();
            }
        }

        final Map<String, Object> indexerConfig = (Map<String, Object>) root.get("indexer");
        if (indexerConfig != null) {
            applyIndexerConfig(indexerConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyIndexerConfig(final Map<String, Object> indexerConfig) {
        if (indexerConfig.containsKey("wait-time-ms")) {
            this.waitTimeMs = ((Number) indexerConfig.get("wait-time-ms")).longValue();
        }
        if (indexerConfig.containsKey("watch-enabled")) {
            this.watchEnabled = (Boolean) indexerConfig.get("watch-enabled");
        }
        if (indexerConfig.containsKey("scan-on-startup")) {
            this.scanOnStartup = (Boolean) indexerConfig.get("scan-on-startup");
        }
        if (indexerConfig.containsKey("watch-poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) indexerConfig.get("watch-poll-interval-ms")).longValue();
        }
        if (indexerConfig.containsKey("store-retry-attempts")) {
            this.storeRetryAttempts = ((Number) indexerConfig.get("store-retry-attempts")).intValue();
        }
        if (indexerConfig.containsKey("entry-extensions")) {
            final Object extensions = indexerConfig.get("entry-extensions");
            if (extensions instanceof List) {
                this.entryExtensions = new ArrayList<>((List<String>) extensions);
            }
        }
        if (indexerConfig.containsKey("category-extensions")) {
            final Object extensions = indexerConfig.get("category-extensions");
            if (extensions instanceof List) {
                this.categoryExtensions = new ArrayList<>((List<String>) extensions);
            }
        }
        if (indexerConfig.containsKey("timezone")) {
            this.timezone = indexerConfig.get("timezone").toString();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envContentDir = System.getenv(ENV_CONTENT_DIR);
        if (envContentDir != null && !envContentDir.trim().isEmpty()) {
            this.contentDirectory = envContentDir.trim();
            logger.info("Content directory from environment: {}", this.contentDirectory);
        }

        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envWaitTime = System.getenv(ENV_WAIT_TIME_MS);
        if (envWaitTime != null && !envWaitTime.trim().isEmpty()) {
            try {
                this.waitTimeMs = Long.parseLong(envWaitTime.trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(ENV_WAIT_TIME_MS + " is not a number: " + envWaitTime, e);
            }
        }

        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "index").toString();
        }

        final String propContentDir = System.getProperty(PROP_CONTENT_DIR);
        if (propContentDir != null && !propContentDir.isEmpty()) {
            this.contentDirectory = propContentDir;
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfile();
    }

    private void validate() {
        if (waitTimeMs < 0) {
            throw new IllegalArgumentException("wait-time-ms must not be negative: " + waitTimeMs);
        }
        if (storeRetryAttempts < 1) {
            throw new IllegalArgumentException("store-retry-attempts must be at least 1: " + storeRetryAttempts);
        }
        // Fails with DateTimeException on unknown zone ids
        ZoneId.of(timezone);
    }

    /**
     * Whether the {@code deployed} profile is active. Readable before any logging is configured.
     */
    public static boolean isDeployedProfile() {
        return "deployed".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public Path getContentDirectory() {
        return Paths.get(contentDirectory);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public long getWaitTimeMs() {
        return waitTimeMs;
    }

    public Duration getWaitTime() {
        return Duration.ofMillis(waitTimeMs);
    }

    public void setWaitTimeMs(final long waitTimeMs) {
        if (waitTimeMs < 0) {
            throw new IllegalArgumentException("wait time must not be negative: " + waitTimeMs);
        }
        this.waitTimeMs = waitTimeMs;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(final boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    public boolean isScanOnStartup() {
        return scanOnStartup;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public int getStoreRetryAttempts() {
        return storeRetryAttempts;
    }

    public List<String> getEntryExtensions() {
        return entryExtensions;
    }

    public List<String> getCategoryExtensions() {
        return categoryExtensions;
    }

    public ZoneId getTimezone() {
        return ZoneId.of(timezone);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
