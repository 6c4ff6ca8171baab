package de.mirkosertic.contentindexer.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file-only output when the indexer runs as a background service.
 * <p>
 * The {@code deployed} profile loads logback-deployed.xml, which writes a rolling log
 * below {@code ~/.contentindexer/log}. Every other profile keeps the console setup from
 * logback.xml that Logback picks up on its own.
 */
public final class LoggingConfigurator {

    private static final String LOG_DIR_PROPERTY = "contentindexer.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used, otherwise early messages still go to the console.
     *
     * @param deployedMode true when running as a background service
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDir = ApplicationConfig.getConfigDirectory().resolve("log");
        if (createLogDirectory(logDir)) {
            System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static boolean createLogDirectory(final Path logDir) {
        try {
            Files.createDirectories(logDir);
            return true;
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ", keeping console logging");
            return false;
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
