package com.glimpse.core.ops;

import com.glimpse.core.image.Frame;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable view of the open document handed to the worker thread.
 *
 * @param path {@code null} for pasted images
 */
public record DocumentSnapshot(List<Frame> frames, int rotation, Path path) {
    public DocumentSnapshot {
        frames = List.copyOf(frames);
    }
}
