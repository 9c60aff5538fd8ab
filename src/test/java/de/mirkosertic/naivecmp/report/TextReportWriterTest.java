package de.mirkosertic.naivecmp.report;

import de.mirkosertic.naivecmp.ComparisonResult;
import de.mirkosertic.naivecmp.ComparisonService;
import de.mirkosertic.naivecmp.TestTrees;
import de.mirkosertic.naivecmp.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TextReportWriter Tests")
class TextReportWriterTest {

    @TempDir
    Path tempDir;

    private ComparisonResult result;
    private Path rootA;
    private Path rootB;

    @BeforeEach
    void setUp() throws Exception {
        rootA = TestTrees.directory(tempDir, "a");
        rootB = TestTrees.directory(tempDir, "b");
        TestTrees.file(rootA, "common.txt", 1);
        TestTrees.file(rootA, "z/last.txt", 2);
        TestTrees.file(rootA, "b/first.txt", 3);
        TestTrees.file(rootB, "common.txt", 1);
        TestTrees.file(rootB, "extra.txt", 4);

        final ApplicationConfig config = ApplicationConfig.defaults();
        config.setWorkers(2);
        config.setSeed(1L);
        result = new ComparisonService(config).compare(rootA, rootB);
    }

    private List<String> lines(final boolean debug) throws Exception {
        final StringWriter out = new StringWriter();
        new TextReportWriter(debug).write(result, out);
        return out.toString().lines().toList();
    }

    @Test
    @DisplayName("Should list leaves of each side depth-first in name order")
    void shouldListLeavesPerSide() throws Exception {
        assertThat(lines(false)).containsExactly(
                "========== Only in " + result.indexA().rootPath() + " ==========",
                "b/first.txt",
                "z/last.txt",
                "========== Only in " + result.indexB().rootPath() + " ==========",
                "extra.txt");
    }

    @Test
    @DisplayName("Should print fingerprints of every leaf in debug mode")
    void shouldPrintFingerprintsInDebugMode() throws Exception {
        // When
        final List<String> lines = lines(true);

        // Then
        assertThat(lines.get(0)).isEqualTo("========== Debug for " + result.indexA().rootPath() + " ==========");
        assertThat(lines.get(1)).matches("b/first\\.txt \\d+");
        assertThat(lines).hasSize(2 + 3 + 2 + 5);
        assertThat(lines.get(4)).isEqualTo("========== Debug for " + result.indexB().rootPath() + " ==========");
    }

    @Test
    @DisplayName("Should print only the headings for identical trees")
    void shouldPrintHeadingsForIdenticalTrees() throws Exception {
        final ComparisonResult identical = new ComparisonService(ApplicationConfig.defaults()).compare(rootB, rootB);
        final StringWriter out = new StringWriter();

        new TextReportWriter(false).write(identical, out);

        assertThat(out.toString().lines()).hasSize(2).allMatch(line -> line.startsWith("========== Only in"));
    }
}
