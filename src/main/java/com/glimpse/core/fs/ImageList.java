package com.glimpse.core.fs;

import com.glimpse.core.io.ImageFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Sorted view of the images that sit next to the displayed file. The index always points at
 * the displayed path while the list is non-empty.
 */
public final class ImageList {

    private static final Logger LOGGER = Logger.getLogger(ImageList.class.getName());
    private static final Comparator<Path> NAME_ORDER =
        Comparator.comparing((Path p) -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(p -> p.getFileName().toString());

    private final List<Path> paths = new ArrayList<>();
    private Path directory;
    private int index;

    /**
     * Points the list at {@code path}, rescanning its directory when it differs from the current
     * one, when {@code forceRescan} is set, or when the file is not listed yet.
     *
     * @return true when the directory changed
     */
    public boolean changeDir(Path path, boolean forceRescan) {
        Path file = normalize(path);
        Path parent = file.getParent();
        boolean directoryChanged = !Objects.equals(parent, directory);
        if (directoryChanged || forceRescan || !paths.contains(file)) {
            rescan(parent);
            if (!paths.contains(file)) {
                paths.add(file);
                paths.sort(NAME_ORDER);
            }
        }
        directory = parent;
        index = paths.indexOf(file);
        return directoryChanged;
    }

    public Optional<Path> peekNext() {
        return step(1);
    }

    public Optional<Path> peekPrev() {
        return step(-1);
    }

    /** Moves the index to {@code path} if it is listed. */
    public boolean select(Path path) {
        int found = paths.indexOf(normalize(path));
        if (found < 0) {
            return false;
        }
        index = found;
        return true;
    }

    public Optional<Path> current() {
        return paths.isEmpty() ? Optional.empty() : Optional.of(paths.get(index));
    }

    public int index() {
        return index;
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public List<Path> paths() {
        return Collections.unmodifiableList(paths);
    }

    public Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }

    public void clear() {
        paths.clear();
        directory = null;
        index = 0;
    }

    private Optional<Path> step(int delta) {
        if (paths.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(paths.get(Math.floorMod(index + delta, paths.size())));
    }

    private void rescan(Path dir) {
        paths.clear();
        if (dir == null || !Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            stream.filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .filter(ImageFormat::isDecodable)
                .map(ImageList::normalize)
                .forEach(paths::add);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not list " + dir, ex);
        }
        paths.sort(NAME_ORDER);
        LOGGER.fine(() -> "Listed " + paths.size() + " image(s) in " + dir);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
