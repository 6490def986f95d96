package com.glimpse.core.ops;

import com.glimpse.core.image.Frame;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one completed {@link Op}, consumed exactly once by the UI poll step. Outputs that
 * change pixels carry the complete new frame set.
 */
public sealed interface Output
    permits Output.ImageLoaded, Output.FlipHorizontal, Output.FlipVertical, Output.Rotate,
    Output.Resize, Output.Color, Output.Crop, Output.Undo, Output.Redo, Output.Close, Output.Done {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitImageLoaded(ImageLoaded output);

        R visitFlipHorizontal(FlipHorizontal output);

        R visitFlipVertical(FlipVertical output);

        R visitRotate(Rotate output);

        R visitResize(Resize output);

        R visitColor(Color output);

        R visitCrop(Crop output);

        R visitUndo(Undo output);

        R visitRedo(Redo output);

        R visitClose(Close output);

        R visitDone(Done output);
    }

    /**
     * @param sourcePath {@code null} for pasted images
     * @param rebuildList rescan the sibling listing even if the directory is unchanged
     */
    record ImageLoaded(List<Frame> frames, Path sourcePath, boolean rebuildList) implements Output {
        public ImageLoaded {
            frames = List.copyOf(frames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImageLoaded(this);
        }
    }

    record FlipHorizontal() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlipHorizontal(this);
        }
    }

    record FlipVertical() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlipVertical(this);
        }
    }

    record Rotate(int quarterTurns) implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRotate(this);
        }
    }

    record Resize(List<Frame> frames) implements Output {
        public Resize {
            frames = List.copyOf(frames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResize(this);
        }
    }

    record Color(List<Frame> frames) implements Output {
        public Color {
            frames = List.copyOf(frames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitColor(this);
        }
    }

    /** {@code rotation} is the document rotation the crop was baked from. */
    record Crop(List<Frame> frames, int rotation) implements Output {
        public Crop {
            frames = List.copyOf(frames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCrop(this);
        }
    }

    record Undo() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUndo(this);
        }
    }

    record Redo() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRedo(this);
        }
    }

    record Close() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClose(this);
        }
    }

    /** Finished with nothing to apply, e.g. a save or a copy. */
    record Done() implements Output {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDone(this);
        }
    }
}
