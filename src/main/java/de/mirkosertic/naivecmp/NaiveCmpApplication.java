package de.mirkosertic.naivecmp;

import de.mirkosertic.naivecmp.config.ApplicationConfig;
import de.mirkosertic.naivecmp.config.BuildInfo;
import de.mirkosertic.naivecmp.config.CommandLineArguments;
import de.mirkosertic.naivecmp.config.LoggingConfigurator;
import de.mirkosertic.naivecmp.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Function;

/**
 * Main entry point: compares two directories and prints the leaves found on only one side.
 */
public class NaiveCmpApplication {

    private static final Logger logger = LoggerFactory.getLogger(NaiveCmpApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;

    private final ApplicationConfig config;
    private final ComparisonService comparisonService;

    public NaiveCmpApplication(final ApplicationConfig config) {
        this(config, new ComparisonService(config));
    }

    NaiveCmpApplication(final ApplicationConfig config, final ComparisonService comparisonService) {
        this.config = config;
        this.comparisonService = comparisonService;
    }

    /**
     * Run the comparison and write the report.
     */
    public void run(final Writer out) throws FilesystemAccessException, InterruptedException, IOException {
        final ComparisonResult result = comparisonService.compare();
        final ReportWriter reportWriter = ReportWriter.forFormat(config.getReportFormat(), config.isDebug());
        reportWriter.write(result, out);
    }

    static int execute(final String[] args, final PrintStream stdout, final PrintStream stderr) {
        return execute(args, stdout, stderr, NaiveCmpApplication::new);
    }

    static int execute(final String[] args, final PrintStream stdout, final PrintStream stderr,
                       final Function<ApplicationConfig, NaiveCmpApplication> applicationFactory) {
        final CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (final ConfigurationException e) {
            stderr.println(e.getMessage());
            stderr.println(CommandLineArguments.USAGE);
            return EXIT_CONFIGURATION;
        }
        if (arguments.isHelpRequested()) {
            stdout.println(CommandLineArguments.USAGE);
            return EXIT_OK;
        }
        if (arguments.isVersionRequested()) {
            stdout.println(BuildInfo.describe());
            return EXIT_OK;
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(arguments.isDebug());

        try {
            final ApplicationConfig config = ApplicationConfig.load();
            arguments.applyTo(config);
            logger.debug("Starting {} with arguments {}", BuildInfo.describe(), Arrays.toString(args));

            final Writer out = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
            applicationFactory.apply(config).run(out);
            out.flush();
            return EXIT_OK;
        } catch (final ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            stderr.println(CommandLineArguments.USAGE);
            return EXIT_CONFIGURATION;
        } catch (final FilesystemAccessException e) {
            logger.error("Aborted, no result produced: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted, no result produced");
            return EXIT_FAILURE;
        } catch (final IOException e) {
            logger.error("Failed to write report", e);
            return EXIT_FAILURE;
        } catch (final InternalConsistencyException e) {
            logger.error("Internal error", e);
            return EXIT_FAILURE;
        } catch (final RuntimeException e) {
            logger.error("Unexpected error, no result produced", e);
            return EXIT_FAILURE;
        }
    }

    public static void main(final String[] args) {
        System.exit(execute(args, System.out, System.err));
    }
}
