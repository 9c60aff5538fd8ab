package de.mirkosertic.naivecmp.config;

import de.mirkosertic.naivecmp.ConfigurationException;
import de.mirkosertic.naivecmp.report.ReportFormat;
import de.mirkosertic.naivecmp.scan.FingerprintAttributes;
import de.mirkosertic.naivecmp.scan.ScanSettings;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Central configuration of a comparison run.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line arguments (applied by {@link CommandLineArguments})
 * 2. Environment variables
 * 3. System properties
 * 4. User config file (~/.naivecmp/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_WORKERS = "NAIVECMP_WORKERS";
    static final String ENV_REPORT_FORMAT = "NAIVECMP_REPORT_FORMAT";
    static final String PROP_WORKERS = "naivecmp.workers";
    static final String PROP_REPORT_FORMAT = "naivecmp.report.format";
    private static final String CONFIG_DIR = ".naivecmp";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Roots
    private @Nullable String directoryA;
    private @Nullable String directoryB;

    // Compare settings
    private int workers = ScanSettings.DEFAULT_WORKER_COUNT;
    private int queueCapacity = ScanSettings.DEFAULT_QUEUE_CAPACITY;
    private @Nullable Long seed;
    private boolean useModificationTime = true;
    private boolean useSize = true;
    private boolean useMode = false;
    private boolean useName = false;
    private boolean useDirectoryPath = false;

    // Report settings
    private ReportFormat reportFormat = ReportFormat.TEXT;
    private boolean debug = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply system properties and environment variables
        config.applyOverrides(System::getenv, System.getProperties());

        logger.debug("Configuration loaded: workers={}, queueCapacity={}, attributes={}, format={}",
                config.workers, config.queueCapacity, config.getFingerprintAttributes().describe(), config.reportFormat);

        return config;
    }

    /**
     * Classpath defaults only, ignoring the user file and the environment.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                loadFromYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                loadFromYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void loadFromYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to naivecmp section
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("naivecmp");
        if (rootConfig == null) {
            return;
        }

        final Map<String, Object> compareConfig = (Map<String, Object>) rootConfig.get("compare");
        if (compareConfig != null) {
            applyCompareConfig(compareConfig);
        }

        final Map<String, Object> reportConfig = (Map<String, Object>) rootConfig.get("report");
        if (reportConfig != null) {
            if (reportConfig.get("format") != null) {
                this.reportFormat = ReportFormat.parse(reportConfig.get("format").toString());
            }
            if (reportConfig.get("debug") != null) {
                this.debug = (Boolean) reportConfig.get("debug");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyCompareConfig(final Map<String, Object> compareConfig) {
        if (compareConfig.get("workers") != null) {
            this.workers = ((Number) compareConfig.get("workers")).intValue();
        }
        if (compareConfig.get("queue-capacity") != null) {
            this.queueCapacity = ((Number) compareConfig.get("queue-capacity")).intValue();
        }
        if (compareConfig.get("seed") != null) {
            this.seed = ((Number) compareConfig.get("seed")).longValue();
        }

        final Map<String, Object> attributes = (Map<String, Object>) compareConfig.get("attributes");
        if (attributes != null) {
            if (attributes.get("modification-time") != null) {
                this.useModificationTime = (Boolean) attributes.get("modification-time");
            }
            if (attributes.get("size") != null) {
                this.useSize = (Boolean) attributes.get("size");
            }
            if (attributes.get("mode") != null) {
                this.useMode = (Boolean) attributes.get("mode");
            }
            if (attributes.get("name") != null) {
                this.useName = (Boolean) attributes.get("name");
            }
            if (attributes.get("directory-path") != null) {
                this.useDirectoryPath = (Boolean) attributes.get("directory-path");
            }
        }
    }

    void applyOverrides(final Function<String, String> environment, final Properties systemProperties) {
        final String propWorkers = systemProperties.getProperty(PROP_WORKERS);
        if (propWorkers != null && !propWorkers.isBlank()) {
            this.workers = parseInt(PROP_WORKERS, propWorkers);
        }
        final String propFormat = systemProperties.getProperty(PROP_REPORT_FORMAT);
        if (propFormat != null && !propFormat.isBlank()) {
            this.reportFormat = ReportFormat.parse(propFormat);
        }

        final String envWorkers = environment.apply(ENV_WORKERS);
        if (envWorkers != null && !envWorkers.trim().isEmpty()) {
            this.workers = parseInt(ENV_WORKERS, envWorkers);
            logger.debug("Worker count from environment: {}", this.workers);
        }
        final String envFormat = environment.apply(ENV_REPORT_FORMAT);
        if (envFormat != null && !envFormat.trim().isEmpty()) {
            this.reportFormat = ReportFormat.parse(envFormat);
        }
    }

    static int parseInt(final String source, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + source + ": '" + value + "'", e);
        }
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * Scan settings for one run. Both roots must be scanned with the same settings so
     * that their fingerprints are comparable.
     *
     * @param runSeed used unless a fixed seed is configured
     * @throws ConfigurationException if worker count or queue capacity is not positive
     */
    public ScanSettings toScanSettings(final long runSeed) {
        return new ScanSettings(workers, queueCapacity, getFingerprintAttributes(), seed != null ? seed : runSeed);
    }

    public FingerprintAttributes getFingerprintAttributes() {
        return new FingerprintAttributes(useModificationTime, useSize, useMode, useName, useDirectoryPath);
    }

    // Getters and setters
    public @Nullable String getDirectoryA() {
        return directoryA;
    }

    public void setDirectoryA(final String directoryA) {
        this.directoryA = directoryA;
    }

    public @Nullable String getDirectoryB() {
        return directoryB;
    }

    public void setDirectoryB(final String directoryB) {
        this.directoryB = directoryB;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(final int workers) {
        this.workers = workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(final int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public @Nullable Long getSeed() {
        return seed;
    }

    public void setSeed(final @Nullable Long seed) {
        this.seed = seed;
    }

    public boolean isUseModificationTime() {
        return useModificationTime;
    }

    public void setUseModificationTime(final boolean useModificationTime) {
        this.useModificationTime = useModificationTime;
    }

    public boolean isUseSize() {
        return useSize;
    }

    public void setUseSize(final boolean useSize) {
        this.useSize = useSize;
    }

    public boolean isUseMode() {
        return useMode;
    }

    public void setUseMode(final boolean useMode) {
        this.useMode = useMode;
    }

    public boolean isUseName() {
        return useName;
    }

    public void setUseName(final boolean useName) {
        this.useName = useName;
    }

    public boolean isUseDirectoryPath() {
        return useDirectoryPath;
    }

    public void setUseDirectoryPath(final boolean useDirectoryPath) {
        this.useDirectoryPath = useDirectoryPath;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    public void setReportFormat(final ReportFormat reportFormat) {
        this.reportFormat = reportFormat;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(final boolean debug) {
        this.debug = debug;
    }
}
