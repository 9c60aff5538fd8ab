package de.mirkosertic.naivecmp.report;

import de.mirkosertic.naivecmp.ConfigurationException;

import java.util.Locale;

public enum ReportFormat {
    TEXT,
    JSON;

    public static ReportFormat parse(final String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException("Unknown report format '" + value + "', expected text or json", e);
        }
    }
}
