package com.glimpse.core.ops;

import com.glimpse.core.image.ColorAdjustment;
import com.glimpse.core.image.CropRect;
import com.glimpse.core.image.ResampleFilter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A requested action, created by the UI and consumed exactly once by {@link OpQueue}.
 */
public sealed interface Op
    permits Op.LoadPath, Op.Save, Op.Next, Op.Prev, Op.Rotate, Op.FlipHorizontal, Op.FlipVertical,
    Op.Crop, Op.Resize, Op.Color, Op.Copy, Op.Paste, Op.Undo, Op.Redo, Op.Close {

    <R> R accept(Visitor<R> visitor) throws IOException;

    /** Whether the op is meaningless without an open document. */
    default boolean requiresDocument() {
        return false;
    }

    interface Visitor<R> {
        R visitLoadPath(LoadPath op) throws IOException;

        R visitSave(Save op) throws IOException;

        R visitNext(Next op) throws IOException;

        R visitPrev(Prev op) throws IOException;

        R visitRotate(Rotate op) throws IOException;

        R visitFlipHorizontal(FlipHorizontal op) throws IOException;

        R visitFlipVertical(FlipVertical op) throws IOException;

        R visitCrop(Crop op) throws IOException;

        R visitResize(Resize op) throws IOException;

        R visitColor(Color op) throws IOException;

        R visitCopy(Copy op) throws IOException;

        R visitPaste(Paste op) throws IOException;

        R visitUndo(Undo op) throws IOException;

        R visitRedo(Redo op) throws IOException;

        R visitClose(Close op) throws IOException;
    }

    /**
     * @param selectInList rebuild the sibling listing around {@code path} (drag and drop)
     */
    record LoadPath(Path path, boolean selectInList) implements Op {
        public LoadPath {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitLoadPath(this);
        }
    }

    record Save(Path path) implements Op {
        public Save {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitSave(this);
        }
    }

    record Next() implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitNext(this);
        }
    }

    record Prev() implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitPrev(this);
        }
    }

    /** Positive turns are clockwise. */
    record Rotate(int quarterTurns) implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitRotate(this);
        }
    }

    record FlipHorizontal() implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitFlipHorizontal(this);
        }
    }

    record FlipVertical() implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitFlipVertical(this);
        }
    }

    /** {@code rect} is in pixels of the image as displayed, rotation included. */
    record Crop(CropRect rect) implements Op {
        public Crop {
            Objects.requireNonNull(rect, "rect");
        }

        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitCrop(this);
        }
    }

    /** Target size in displayed orientation. */
    record Resize(int width, int height, ResampleFilter filter) implements Op {
        public Resize {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Resize target must be positive: " + width + "x" + height);
            }
            Objects.requireNonNull(filter, "filter");
        }

        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitResize(this);
        }
    }

    record Color(ColorAdjustment adjustment) implements Op {
        public Color {
            Objects.requireNonNull(adjustment, "adjustment");
        }

        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitColor(this);
        }
    }

    record Copy() implements Op {
        @Override
        public boolean requiresDocument() {
            return true;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitCopy(this);
        }
    }

    record Paste() implements Op {
        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitPaste(this);
        }
    }

    record Undo() implements Op {
        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitUndo(this);
        }
    }

    record Redo() implements Op {
        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitRedo(this);
        }
    }

    record Close() implements Op {
        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.visitClose(this);
        }
    }
}
