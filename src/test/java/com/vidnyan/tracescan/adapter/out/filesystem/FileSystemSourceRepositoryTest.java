package com.vidnyan.tracescan.adapter.out.filesystem;

import com.vidnyan.tracescan.application.port.out.SourceFileRepository.SourceListing;
import com.vidnyan.tracescan.domain.finding.FileFailure;
import com.vidnyan.tracescan.exception.DirectoryNotFoundException;
import com.vidnyan.tracescan.exception.FileAccessException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSystemSourceRepositoryTest {

    private static final Set<String> EXTENSIONS = Set.of(".java", ".kt");

    @TempDir
    Path tempDir;

    private final FileSystemSourceRepository repository = new FileSystemSourceRepository();

    @Test
    void listSourceFiles_ShouldFindJavaAndKotlinFiles() throws IOException {
        // Arrange
        Path main = tempDir.resolve("app/src/main/java/com/example");
        Files.createDirectories(main);
        Files.writeString(main.resolve("Test1.java"), "public class Test1 {}");
        Files.writeString(main.resolve("Test2.KT"), "class Test2");
        Files.writeString(main.resolve("readme.txt"), "documentation");

        Path generated = tempDir.resolve("app/build/generated");
        Files.createDirectories(generated);
        Files.writeString(generated.resolve("R.java"), "public final class R {}");

        // Act
        List<Path> results = repository.listSourceFiles(tempDir, EXTENSIONS, List.of("/build/")).files();

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.get(0).endsWith("Test1.java"));
        assertTrue(results.get(1).endsWith("Test2.KT"));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("readme.txt")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("R.java")));
    }

    @Test
    void listSourceFiles_ShouldIncludeEverythingWithoutExcludes() throws IOException {
        Files.createDirectories(tempDir.resolve("build"));
        Files.writeString(tempDir.resolve("build/Gen.java"), "class Gen {}");
        Files.writeString(tempDir.resolve("Root.kt"), "class Root");

        List<Path> results = repository.listSourceFiles(tempDir, EXTENSIONS, List.of()).files();

        assertEquals(2, results.size());
    }

    @Test
    void listSourceFiles_ShouldFollowSymbolicLinks() throws IOException {
        // Arrange
        Path shared = Files.createDirectories(tempDir.resolve("shared"));
        Files.writeString(shared.resolve("Util.kt"), "object Util");
        Path app = Files.createDirectories(tempDir.resolve("app"));
        assumeTrue(createLink(app.resolve("Linked.kt"), shared.resolve("Util.kt")));
        assumeTrue(createLink(app.resolve("loop"), tempDir));

        // Act
        SourceListing listing = repository.listSourceFiles(tempDir, EXTENSIONS, List.of());

        // Assert
        assertTrue(listing.files().contains(app.resolve("Linked.kt")));
        assertTrue(listing.files().contains(shared.resolve("Util.kt")));
        assertTrue(listing.failures().isEmpty());
    }

    @Test
    void listSourceFiles_ShouldRecordBrokenLinkAsFailure() throws IOException {
        Files.writeString(tempDir.resolve("Main.java"), "class Main {}");
        Path dangling = tempDir.resolve("Gone.java");
        assumeTrue(createLink(dangling, tempDir.resolve("deleted/Gone.java")));

        SourceListing listing = repository.listSourceFiles(tempDir, EXTENSIONS, List.of());

        assertEquals(List.of(tempDir.resolve("Main.java")), listing.files());
        assertEquals(1, listing.failures().size());
        FileFailure failure = listing.failures().get(0);
        assertEquals(dangling.toString(), failure.filePath());
        assertTrue(failure.reason().contains("broken symbolic link"));
    }

    @Test
    void listSourceFiles_ShouldRejectMissingRoot() {
        Path missing = tempDir.resolve("nope");

        DirectoryNotFoundException e = assertThrows(DirectoryNotFoundException.class,
                () -> repository.listSourceFiles(missing, EXTENSIONS, List.of()));
        assertEquals(missing, e.getRoot());
    }

    @Test
    void readLines_ShouldReplaceMalformedBytes() throws IOException {
        Path file = tempDir.resolve("Bad.kt");
        Files.write(file, new byte[] {'a', (byte) 0xFF, 'b', '\n', 'c'});

        List<String> lines = repository.readLines(file);

        assertEquals(List.of("a\uFFFDb", "c"), lines);
    }

    @Test
    void readLines_ShouldWrapIoErrors() {
        Path missing = tempDir.resolve("Missing.java");

        FileAccessException e = assertThrows(FileAccessException.class, () -> repository.readLines(missing));
        assertEquals(missing, e.getFile());
        assertTrue(e.getMessage().contains("NoSuchFileException"));
    }

    private static boolean createLink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            return false;
        }
    }
}
