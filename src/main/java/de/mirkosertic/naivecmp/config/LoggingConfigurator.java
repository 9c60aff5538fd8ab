package de.mirkosertic.naivecmp.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Configures logging for the requested verbosity.
 * <p>
 * By default logback.xml is used: INFO progress messages on stderr, so stdout only
 * carries the report. In debug mode logback-debug.xml is loaded, which adds thread
 * names and DEBUG output of the scanner and matcher.
 */
public final class LoggingConfigurator {

    private static final String DEBUG_CONFIG = "logback-debug.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called early in application startup, before logging is used.
     *
     * @param debugMode true to enable debug output
     */
    public static void configure(final boolean debugMode) {
        if (debugMode) {
            loadConfiguration(DEBUG_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
