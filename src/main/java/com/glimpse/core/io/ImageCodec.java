package com.glimpse.core.io;

import com.glimpse.core.image.Frame;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Format-dispatching decoder/encoder used by the operation worker.
 */
public interface ImageCodec {

    /**
     * @return at least one frame; more than one for animations
     * @throws DecodeException when the file is not a readable image
     */
    List<Frame> decode(Path path) throws IOException;

    /**
     * Writes {@code frames} to {@code path}. Implementations must leave an existing file at
     * {@code path} untouched when encoding fails.
     */
    void encode(Path path, ImageFormat format, List<Frame> frames) throws IOException;
}
