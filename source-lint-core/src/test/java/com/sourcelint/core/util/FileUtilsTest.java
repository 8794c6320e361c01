package com.sourcelint.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withSourceGlob_matchesNestedFiles() throws IOException {
        Path top = write("App.swift");
        Path nested = write("Sources/Views/View.swift");
        write("Sources/Views/View.swift.structure.json");
        write("README.md");

        List<Path> files = FileUtils.findFiles(tempDir, FileUtils.SOURCE_GLOB);

        assertThat(files).containsExactlyInAnyOrder(top, nested);
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        List<Path> files = FileUtils.findFiles(tempDir, FileUtils.SOURCE_GLOB);

        assertThat(files).isEmpty();
    }

    @Test
    void findFiles_singleFileRoot_returnsFileWhenNameMatches() throws IOException {
        Path file = write("Main.swift");
        Path other = write("notes.txt");

        assertThat(FileUtils.findFiles(file, FileUtils.SOURCE_GLOB)).containsExactly(file);
        assertThat(FileUtils.findFiles(other, FileUtils.SOURCE_GLOB)).isEmpty();
    }

    @Test
    void findSourceFiles_skipsExcludedPaths() throws IOException {
        Path kept = write("Sources/App.swift");
        write("Sources/Generated/Model.swift");
        write("Pods/Lib.swift");

        List<Path> files = FileUtils.findSourceFiles(
            List.of(tempDir),
            List.of(tempDir.resolve("Sources/Generated"), tempDir.resolve("Pods")));

        assertThat(files).containsExactly(kept);
    }

    @Test
    void findSourceFiles_overlappingRoots_returnEachFileOnce() throws IOException {
        Path file = write("Sources/App.swift");

        List<Path> files = FileUtils.findSourceFiles(List.of(tempDir, tempDir.resolve("Sources")), List.of());

        assertThat(files).hasSize(1);
        assertThat(files.get(0).toAbsolutePath().normalize()).isEqualTo(file.toAbsolutePath().normalize());
    }

    @Test
    void findSourceFiles_rootsSpelledDifferently_keepFirstSpelling() throws IOException {
        Path file = write("Sources/App.swift");
        Path other = write("Sources/Views/View.swift");

        List<Path> files = FileUtils.findSourceFiles(
            List.of(tempDir.resolve("Sources"), tempDir.resolve("Sources/../Sources")),
            List.of());

        assertThat(files).containsExactlyInAnyOrder(file, other);
    }

    @Test
    void findSourceFiles_missingRoot_throwsException() {
        assertThatThrownBy(() -> FileUtils.findSourceFiles(List.of(tempDir.resolve("nope")), List.of()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
    }

    private Path write(String relative) throws IOException {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "// test");
        return path;
    }
}
