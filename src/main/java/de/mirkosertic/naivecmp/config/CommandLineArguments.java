package de.mirkosertic.naivecmp.config;

import de.mirkosertic.naivecmp.ConfigurationException;
import de.mirkosertic.naivecmp.report.ReportFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed command line: {@code naivecmp [options] <dirA> <dirB>}.
 * <p>
 * Options use the {@code --name=value} form. Boolean options may omit the value.
 */
public final class CommandLineArguments {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: naivecmp [options] <dirA> <dirB>",
            "",
            "Compare directories by fuzzy-matching file attributes without checking contents.",
            "",
            "Options:",
            "  --workers=N              Parallel workers per directory (default 6)",
            "  --queue-capacity=N       Capacity of the shared scan queue (default 1024)",
            "  --seed=N                 Fixed fingerprint seed (default: random per run)",
            "  --use-mod-time[=bool]    Use file modification time (default true)",
            "  --use-size[=bool]        Use file size (default true)",
            "  --use-mode[=bool]        Use file mode (default false)",
            "  --use-name[=bool]        Use file name even when there is no collision (default false)",
            "  --use-path[=bool]        Use file directory path (default false)",
            "  --format=text|json       Report format (default text)",
            "  --debug                  Print fingerprints and debug output",
            "  --version                Print version information",
            "  --help                   Print this help");

    private final List<String> roots;
    private final Map<String, String> options;

    private CommandLineArguments(final List<String> roots, final Map<String, String> options) {
        this.roots = roots;
        this.options = options;
    }

    /**
     * @throws ConfigurationException on unknown options or malformed values
     */
    public static CommandLineArguments parse(final String[] args) {
        final List<String> roots = new ArrayList<>();
        final Map<String, String> options = new LinkedHashMap<>();
        boolean onlyRoots = false;

        for (final String arg : args) {
            if (onlyRoots || !arg.startsWith("--")) {
                roots.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                onlyRoots = true;
                continue;
            }
            final int separator = arg.indexOf('=');
            final String name = separator < 0 ? arg.substring(2) : arg.substring(2, separator);
            final String value = separator < 0 ? null : arg.substring(separator + 1);
            options.put(name, validate(name, value));
        }
        return new CommandLineArguments(Collections.unmodifiableList(roots), Collections.unmodifiableMap(options));
    }

    private static String validate(final String name, final String value) {
        switch (name) {
            case "help", "version", "debug", "use-mod-time", "use-size", "use-mode", "use-name", "use-path":
                return value == null ? "true" : Boolean.toString(parseBoolean(name, value));
            case "workers", "queue-capacity":
                return Integer.toString(ApplicationConfig.parseInt("--" + name, requireValue(name, value)));
            case "seed":
                return Long.toString(parseLong(name, requireValue(name, value)));
            case "format":
                return ReportFormat.parse(requireValue(name, value)).name();
            default:
                throw new ConfigurationException("Unknown option --" + name);
        }
    }

    private static String requireValue(final String name, final String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Option --" + name + " requires a value");
        }
        return value;
    }

    private static boolean parseBoolean(final String name, final String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1":
                return true;
            case "false", "no", "0":
                return false;
            default:
                throw new ConfigurationException("Option --" + name + " expects true or false, got '" + value + "'");
        }
    }

    private static long parseLong(final String name, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("Invalid number for --" + name + ": '" + value + "'", e);
        }
    }

    public boolean isHelpRequested() {
        return Boolean.parseBoolean(options.get("help"));
    }

    public boolean isVersionRequested() {
        return Boolean.parseBoolean(options.get("version"));
    }

    public boolean isDebug() {
        return Boolean.parseBoolean(options.get("debug"));
    }

    public List<String> getRoots() {
        return roots;
    }

    /**
     * Copy roots and explicitly given options onto the configuration.
     *
     * @throws ConfigurationException unless exactly two roots were given
     */
    public void applyTo(final ApplicationConfig config) {
        if (roots.size() != 2) {
            throw new ConfigurationException("Expected exactly two directories, got " + roots.size());
        }
        config.setDirectoryA(roots.get(0));
        config.setDirectoryB(roots.get(1));

        if (options.containsKey("workers")) {
            config.setWorkers(Integer.parseInt(options.get("workers")));
        }
        if (options.containsKey("queue-capacity")) {
            config.setQueueCapacity(Integer.parseInt(options.get("queue-capacity")));
        }
        if (options.containsKey("seed")) {
            config.setSeed(Long.parseLong(options.get("seed")));
        }
        if (options.containsKey("use-mod-time")) {
            config.setUseModificationTime(Boolean.parseBoolean(options.get("use-mod-time")));
        }
        if (options.containsKey("use-size")) {
            config.setUseSize(Boolean.parseBoolean(options.get("use-size")));
        }
        if (options.containsKey("use-mode")) {
            config.setUseMode(Boolean.parseBoolean(options.get("use-mode")));
        }
        if (options.containsKey("use-name")) {
            config.setUseName(Boolean.parseBoolean(options.get("use-name")));
        }
        if (options.containsKey("use-path")) {
            config.setUseDirectoryPath(Boolean.parseBoolean(options.get("use-path")));
        }
        if (options.containsKey("format")) {
            config.setReportFormat(ReportFormat.valueOf(options.get("format")));
        }
        if (options.containsKey("debug")) {
            config.setDebug(isDebug());
        }
    }
}
