package de.mirkosertic.naivecmp.diff;

import de.mirkosertic.naivecmp.TestTrees;
import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.scan.DirectoryScanner;
import de.mirkosertic.naivecmp.scan.FingerprintAttributes;
import de.mirkosertic.naivecmp.scan.ScanSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TreeMatcher Tests")
class TreeMatcherTest {

    private static final long SEED = 7L;

    @TempDir
    Path tempDir;

    private Path rootA;
    private Path rootB;
    private TreeMatcher matcher;

    @BeforeEach
    void setUp() throws IOException {
        rootA = TestTrees.directory(tempDir, "a");
        rootB = TestTrees.directory(tempDir, "b");
        matcher = new TreeMatcher();
    }

    private DirectoryIndex scan(final Path root, final FingerprintAttributes attributes) throws Exception {
        return new DirectoryScanner(ScanSettings.of(3, attributes, SEED)).scan(root);
    }

    private DirectoryIndex scan(final Path root) throws Exception {
        return scan(root, FingerprintAttributes.defaults());
    }

    @Nested
    @DisplayName("Fingerprint matching")
    class FingerprintMatchingTests {

        @Test
        @DisplayName("Should match a file moved to another directory")
        void shouldMatchMovedFile() throws Exception {
            // Given
            TestTrees.file(rootA, "x/1.txt", 10);
            TestTrees.file(rootB, "y/1.txt", 10);

            // When
            final DirectoryIndex a = scan(rootA);
            final DirectoryIndex b = scan(rootB);
            final DiffTree onlyInA = matcher.diff(a, b);
            final DiffTree onlyInB = matcher.diff(b, a);

            // Then
            assertThat(onlyInA.isEmpty()).isTrue();
            assertThat(onlyInB.isEmpty()).isTrue();
            assertThat(onlyInA.statistics().matchedByFingerprint()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report a file whose size changed on both sides")
        void shouldReportChangedSize() throws Exception {
            // Given
            TestTrees.file(rootA, "x/1.txt", 10);
            TestTrees.file(rootB, "y/1.txt", 11);

            // When
            final DirectoryIndex a = scan(rootA);
            final DirectoryIndex b = scan(rootB);

            // Then
            assertThat(matcher.diff(a, b).leafPaths()).containsExactly("x/1.txt");
            assertThat(matcher.diff(b, a).leafPaths()).containsExactly("y/1.txt");
            assertThat(matcher.diff(a, b).statistics().missing()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report a file whose modification time changed")
        void shouldReportChangedModificationTime() throws Exception {
            TestTrees.file(rootA, "doc.txt", 10);
            TestTrees.file(rootB, "doc.txt", 10, TestTrees.time("2024-02-01T08:00:00Z"));

            final DiffTree onlyInA = matcher.diff(scan(rootA), scan(rootB));

            assertThat(onlyInA.leafPaths()).containsExactly("doc.txt");
        }

        @Test
        @DisplayName("Should match on name alone when only the name is used")
        void shouldMatchOnNameOnly() throws Exception {
            // Given
            TestTrees.file(rootA, "a/f.txt", 10);
            TestTrees.file(rootB, "b/f.txt", 20, TestTrees.time("2020-05-05T05:05:05Z"));

            // When
            final DiffTree onlyInA = matcher.diff(
                    scan(rootA, FingerprintAttributes.nameOnly()),
                    scan(rootB, FingerprintAttributes.nameOnly()));

            // Then
            assertThat(onlyInA.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should find nothing when comparing a tree with itself")
        void shouldFindNothingForIdenticalTrees() throws Exception {
            TestTrees.populate(rootA, 10, 4);

            final DirectoryIndex first = scan(rootA);
            final DirectoryIndex second = scan(rootA);

            assertThat(matcher.diff(first, second).isEmpty()).isTrue();
            assertThat(matcher.diff(first, second).statistics().leavesCompared()).isEqualTo(40);
        }
    }

    @Nested
    @DisplayName("Collision fallback")
    class CollisionTests {

        @Test
        @DisplayName("Should match colliding leaves only at the same relative path")
        void shouldFallBackToRelativePath() throws Exception {
            // Given: both sides contain two leaves with identical size and time
            TestTrees.file(rootA, "x/a.txt", 10);
            TestTrees.file(rootA, "y/b.txt", 10);
            TestTrees.file(rootB, "x/a.txt", 10);
            TestTrees.file(rootB, "z/c.txt", 10);

            // When
            final DirectoryIndex a = scan(rootA);
            final DirectoryIndex b = scan(rootB);
            final DiffTree onlyInA = matcher.diff(a, b);
            final DiffTree onlyInB = matcher.diff(b, a);

            // Then
            assertThat(onlyInA.leafPaths()).containsExactly("y/b.txt");
            assertThat(onlyInB.leafPaths()).containsExactly("z/c.txt");
            assertThat(onlyInA.statistics().matchedByPath()).isEqualTo(1);
            assertThat(onlyInA.statistics().collisionMisses()).isEqualTo(1);
            assertThat(onlyInA.statistics().unmatched()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should match a single candidate even if the source side collides")
        void shouldMatchSingleCandidateForCollidingSource() throws Exception {
            TestTrees.file(rootA, "one.txt", 10);
            TestTrees.file(rootA, "two.txt", 10);
            TestTrees.file(rootB, "elsewhere/three.txt", 10);

            final DiffTree onlyInA = matcher.diff(scan(rootA), scan(rootB));

            assertThat(onlyInA.isEmpty()).isTrue();
            assertThat(onlyInA.statistics().matchedByFingerprint()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should match identical trees even when all attributes are disabled")
        void shouldMatchSelfWithoutAttributes() throws Exception {
            // Given: every leaf shares one fingerprint
            TestTrees.populate(rootA, 4, 3);
            final FingerprintAttributes none = new FingerprintAttributes(false, false, false, false, false);

            // When
            final DirectoryIndex first = scan(rootA, none);
            final DirectoryIndex second = scan(rootA, none);
            final DiffTree diff = matcher.diff(first, second);

            // Then
            assertThat(first.bucketCount()).isEqualTo(1);
            assertThat(diff.isEmpty()).isTrue();
            assertThat(diff.statistics().matchedByPath()).isEqualTo(12);
        }
    }

    @Nested
    @DisplayName("Result shape")
    class ResultShapeTests {

        @Test
        @DisplayName("Should contain only unmatched leaves and their ancestors")
        void shouldContainOnlyAncestorsOfUnmatchedLeaves() throws Exception {
            // Given
            TestTrees.file(rootA, "keep/same.txt", 5);
            TestTrees.file(rootA, "deep/er/gone.txt", 6);
            TestTrees.directory(rootA, "empty");
            TestTrees.file(rootB, "keep/same.txt", 5);

            // When
            final DiffTree onlyInA = matcher.diff(scan(rootA), scan(rootB));

            // Then
            assertThat(onlyInA.list(onlyInA.root())).containsExactly("deep");
            assertThat(onlyInA.contains("deep/er")).isTrue();
            assertThat(onlyInA.contains("keep")).isFalse();
            assertThat(onlyInA.contains("empty")).isFalse();
            assertThat(onlyInA.leafPaths()).containsExactly("deep/er/gone.txt");
        }

        @Test
        @DisplayName("Should be empty when the source has only empty directories")
        void shouldIgnoreEmptyDirectories() throws Exception {
            TestTrees.directory(rootA, "one/two");
            TestTrees.file(rootB, "file.txt", 1);

            final DiffTree onlyInA = matcher.diff(scan(rootA), scan(rootB));

            assertThat(onlyInA.isEmpty()).isTrue();
            assertThat(onlyInA.root().childCount()).isZero();
            assertThat(onlyInA.statistics().leavesCompared()).isZero();
        }
    }
}
