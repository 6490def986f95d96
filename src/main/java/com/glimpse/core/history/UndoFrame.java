package com.glimpse.core.history;

import com.glimpse.core.image.Frame;

import java.util.List;
import java.util.Objects;

/**
 * Enough state to reverse one applied edit. Rotations and flips describe themselves; crop,
 * resize and color keep the complete frame set that is not currently displayed and exchange it
 * with the document on every undo or redo.
 */
public sealed interface UndoFrame
    permits UndoFrame.Rotate, UndoFrame.FlipHorizontal, UndoFrame.FlipVertical,
    UndoFrame.Crop, UndoFrame.Resize, UndoFrame.Color {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitRotate(Rotate frame);

        R visitFlipHorizontal(FlipHorizontal frame);

        R visitFlipVertical(FlipVertical frame);

        R visitCrop(Crop frame);

        R visitResize(Resize frame);

        R visitColor(Color frame);
    }

    /** Reversed by rotating {@code -quarterTurns}. */
    record Rotate(int quarterTurns) implements UndoFrame {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRotate(this);
        }
    }

    record FlipHorizontal() implements UndoFrame {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlipHorizontal(this);
        }
    }

    record FlipVertical() implements UndoFrame {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlipVertical(this);
        }
    }

    final class Crop implements UndoFrame {
        private List<Frame> frames;
        private int rotation;

        public Crop(List<Frame> frames, int rotation) {
            this.frames = List.copyOf(frames);
            this.rotation = rotation;
        }

        public List<Frame> frames() {
            return frames;
        }

        public int rotation() {
            return rotation;
        }

        /** Stores {@code displayed} and returns the frames held until now. */
        public List<Frame> swapFrames(List<Frame> displayed) {
            List<Frame> held = frames;
            frames = List.copyOf(Objects.requireNonNull(displayed));
            return held;
        }

        public int swapRotation(int displayed) {
            int held = rotation;
            rotation = displayed;
            return held;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCrop(this);
        }
    }

    final class Resize implements UndoFrame {
        private List<Frame> frames;

        public Resize(List<Frame> frames) {
            this.frames = List.copyOf(frames);
        }

        public List<Frame> frames() {
            return frames;
        }

        public List<Frame> swapFrames(List<Frame> displayed) {
            List<Frame> held = frames;
            frames = List.copyOf(Objects.requireNonNull(displayed));
            return held;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResize(this);
        }
    }

    final class Color implements UndoFrame {
        private List<Frame> frames;

        public Color(List<Frame> frames) {
            this.frames = List.copyOf(frames);
        }

        public List<Frame> frames() {
            return frames;
        }

        public List<Frame> swapFrames(List<Frame> displayed) {
            List<Frame> held = frames;
            frames = List.copyOf(Objects.requireNonNull(displayed));
            return held;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitColor(this);
        }
    }
}
