package com.glimpse.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a file cannot be turned into frames: unknown extension, corrupt data or a format
 * the installed readers do not understand.
 */
public class DecodeException extends IOException {
    private final transient Path path;

    public DecodeException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public DecodeException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
