package de.mirkosertic.naivecmp.report;

import de.mirkosertic.naivecmp.ComparisonResult;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a finished comparison.
 */
public interface ReportWriter {

    void write(ComparisonResult result, Writer out) throws IOException;

    static ReportWriter forFormat(final ReportFormat format, final boolean debug) {
        return switch (format) {
            case TEXT -> new TextReportWriter(debug);
            case JSON -> new JsonReportWriter(debug);
        };
    }
}
