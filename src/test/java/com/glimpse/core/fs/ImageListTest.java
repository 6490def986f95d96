package com.glimpse.core.fs;

import com.glimpse.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageListTest {

    @TempDir
    Path tempDir;

    private Path a;
    private Path b;
    private Path c;

    @BeforeEach
    void createImages() throws IOException {
        a = TestImages.writePng(tempDir.resolve("a.png"), 2, 2);
        b = TestImages.writePng(tempDir.resolve("B.png"), 2, 2);
        c = TestImages.writePng(tempDir.resolve("c.png"), 2, 2);
        Files.writeString(tempDir.resolve("notes.txt"), "skip me");
        TestImages.writePng(tempDir.resolve(".hidden.png"), 2, 2);
        Files.createDirectories(tempDir.resolve("folder.png"));
    }

    @Test
    void listsDecodableSiblingsInCaseInsensitiveOrder() {
        ImageList list = new ImageList();

        assertTrue(list.changeDir(b, false));

        assertEquals(List.of(norm(a), norm(b), norm(c)), list.paths());
        assertEquals(1, list.index());
        assertEquals(norm(b), list.current().orElseThrow());
    }

    @Test
    void navigationWrapsAround() {
        ImageList list = new ImageList();
        list.changeDir(c, false);
        assertEquals(norm(a), list.peekNext().orElseThrow());

        list.changeDir(a, false);
        assertEquals(norm(c), list.peekPrev().orElseThrow());
    }

    @Test
    void sameDirectoryDoesNotReportAChange() {
        ImageList list = new ImageList();
        list.changeDir(a, false);

        assertFalse(list.changeDir(c, false));
        assertEquals(2, list.index());
    }

    @Test
    void forcedRescanPicksUpNewFiles() throws IOException {
        ImageList list = new ImageList();
        list.changeDir(a, false);
        Path added = TestImages.writePng(tempDir.resolve("aa.png"), 2, 2);

        list.changeDir(a, true);

        assertEquals(4, list.size());
        assertEquals(norm(added), list.peekNext().orElseThrow());
    }

    @Test
    void emptyListHasNowhereToGo() {
        ImageList list = new ImageList();
        assertTrue(list.peekNext().isEmpty());
        assertTrue(list.peekPrev().isEmpty());
        assertTrue(list.current().isEmpty());
    }

    @Test
    void clearForgetsTheDirectory() {
        ImageList list = new ImageList();
        list.changeDir(a, false);
        list.clear();
        assertTrue(list.isEmpty());
        assertTrue(list.directory().isEmpty());
    }

    private static Path norm(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
