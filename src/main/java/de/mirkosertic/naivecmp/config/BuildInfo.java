package de.mirkosertic.naivecmp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Build information provider that loads version and timestamp from Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when running in IDE or when the properties file is not available.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String VERSION_KEY = "build.version";
    private static final String TIMESTAMP_KEY = "build.timestamp";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }

        version = filteredOrDefault(props.getProperty(VERSION_KEY), "dev");
        buildTimestamp = filteredOrDefault(props.getProperty(TIMESTAMP_KEY), "unknown");
    }

    private BuildInfo() {
        // Prevent instantiation
    }

    // An unfiltered resource still contains the ${...} placeholder
    private static String filteredOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    public static String describe() {
        return "naivecmp " + version + " (built " + buildTimestamp + ")";
    }
}
