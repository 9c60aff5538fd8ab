package de.mirkosertic.naivecmp.report;

import de.mirkosertic.naivecmp.ComparisonResult;
import de.mirkosertic.naivecmp.Side;
import de.mirkosertic.naivecmp.diff.DiffTree;
import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.tree.Entry;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Map;

/**
 * Flat text report: one section per root listing the paths only found there.
 * With debug enabled, the fingerprint of every leaf is listed first.
 */
public class TextReportWriter implements ReportWriter {

    private final boolean debug;

    public TextReportWriter(final boolean debug) {
        this.debug = debug;
    }

    @Override
    public void write(final ComparisonResult result, final Writer out) throws IOException {
        final PrintWriter writer = new PrintWriter(out);
        if (debug) {
            for (final Side side : Side.values()) {
                writeDebug(result.index(side), writer);
            }
        }
        for (final Side side : Side.values()) {
            writer.printf("========== Only in %s ==========%n", result.index(side).rootPath());
            writeLeaves(result.diff(side), result.diff(side).root(), writer);
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("Failed to write text report");
        }
    }

    private static void writeDebug(final DirectoryIndex index, final PrintWriter writer) {
        writer.printf("========== Debug for %s ==========%n", index.rootPath());
        for (final Map.Entry<Entry, Long> leaf : index.fingerprintedLeaves()) {
            writer.printf("%s %s%n", leaf.getKey().relativePath(), Long.toUnsignedString(leaf.getValue()));
        }
    }

    // Depth-first in name order
    private static void writeLeaves(final DiffTree diff, final Entry entry, final PrintWriter writer) {
        if (entry.isLeaf()) {
            writer.println(diff.path(entry));
            return;
        }
        for (final String name : diff.list(entry)) {
            diff.child(entry, name).ifPresent(child -> writeLeaves(diff, child, writer));
        }
    }
}
