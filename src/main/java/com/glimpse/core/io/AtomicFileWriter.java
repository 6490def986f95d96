package com.glimpse.core.io;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a file through a hidden temporary sibling that is renamed over the destination, so
 * readers only ever see the old or the complete new content.
 */
public final class AtomicFileWriter {

    private static final Logger LOGGER = Logger.getLogger(AtomicFileWriter.class.getName());

    @FunctionalInterface
    public interface StreamWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    private AtomicFileWriter() {
    }

    public static void write(Path target, StreamWriter writer) throws IOException {
        Path destination = target.toAbsolutePath();
        Path temp = temporarySibling(destination);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writer.writeTo(out);
            }
            moveIntoPlace(temp, destination);
        } catch (IOException | RuntimeException ex) {
            deleteTemp(temp, ex);
            throw ex;
        }
    }

    static Path temporarySibling(Path destination) {
        String id = "." + UUID.randomUUID().toString().replace("-", "") + ".tmp";
        return destination.resolveSibling(id);
    }

    private static void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.fine(() -> "Atomic move unsupported for " + destination + ", falling back to replace");
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, Exception original) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            original.addSuppressed(cleanup);
            LOGGER.log(Level.WARNING, "Could not remove temporary file " + temp, cleanup);
        }
    }
}
