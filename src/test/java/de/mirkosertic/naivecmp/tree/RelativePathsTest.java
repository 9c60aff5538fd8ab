package de.mirkosertic.naivecmp.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RelativePaths Tests")
class RelativePathsTest {

    @Test
    @DisplayName("Should split into segments ignoring empty ones")
    void shouldSplitIntoSegments() {
        assertThat(RelativePaths.segments("a/b/c.txt")).containsExactly("a", "b", "c.txt");
        assertThat(RelativePaths.segments("/a//b/")).containsExactly("a", "b");
        assertThat(RelativePaths.segments("")).isEmpty();
    }

    @Test
    @DisplayName("Should compute parent and child paths")
    void shouldComputeParentAndChild() {
        assertThat(RelativePaths.parent("a/b/c.txt")).isEqualTo("a/b");
        assertThat(RelativePaths.parent("c.txt")).isEmpty();
        assertThat(RelativePaths.child("", "c.txt")).isEqualTo("c.txt");
        assertThat(RelativePaths.child("a/b", "c.txt")).isEqualTo("a/b/c.txt");
    }

    @Test
    @DisplayName("Should relativize with '/' regardless of the host separator")
    void shouldRelativizeWithSlash() {
        final Path root = Path.of("data", "backup");
        final Path nested = root.resolve("x").resolve("y").resolve("1.txt");

        assertThat(RelativePaths.of(root, nested)).isEqualTo("x/y/1.txt");
        assertThat(RelativePaths.of(root, root)).isEmpty();
    }
}
