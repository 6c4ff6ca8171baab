package de.mirkosertic.contentindexer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time from the Maven-filtered build-info.properties.
 * Unfiltered or missing values (IDE runs) fall back to {@code dev} / {@code unknown}.
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final BuildInfo CURRENT = load(BUILD_INFO_FILE);

    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("{} not found, using development defaults", resource);
                return new BuildInfo("dev", "unknown");
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    filtered(props.getProperty("build.version"), "dev"),
                    filtered(props.getProperty("build.timestamp"), "unknown"));
        } catch (final IOException e) {
            logger.warn("Failed to load {}, using development defaults", resource, e);
            return new BuildInfo("dev", "unknown");
        }
    }

    // Maven leaves ${...} untouched when the resource was copied without filtering
    private static String filtered(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }
}
