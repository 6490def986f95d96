package com.glimpse.core.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Linear edit history. Entries below the cursor can be undone, entries at or above it were
 * undone and can be redone. Pushing after an undo discards the redoable tail.
 */
public final class UndoStack {

    public static final int UNLIMITED = 0;

    private final List<UndoFrame> frames = new ArrayList<>();
    private final int limit;
    private int cursor;

    public UndoStack() {
        this(UNLIMITED);
    }

    /**
     * @param limit maximum retained entries, oldest dropped first; {@link #UNLIMITED} for none
     */
    public UndoStack(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Undo limit must not be negative: " + limit);
        }
        this.limit = limit;
    }

    public void push(UndoFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame");
        }
        frames.subList(cursor, frames.size()).clear();
        frames.add(frame);
        cursor++;
        if (limit != UNLIMITED && frames.size() > limit) {
            int excess = frames.size() - limit;
            frames.subList(0, excess).clear();
            cursor -= excess;
        }
    }

    /** Steps back; the returned frame must be applied in reverse. */
    public Optional<UndoFrame> undo() {
        if (cursor == 0) {
            return Optional.empty();
        }
        cursor--;
        return Optional.of(frames.get(cursor));
    }

    /** Steps forward; the returned frame must be applied again. */
    public Optional<UndoFrame> redo() {
        if (cursor == frames.size()) {
            return Optional.empty();
        }
        UndoFrame frame = frames.get(cursor);
        cursor++;
        return Optional.of(frame);
    }

    public void clear() {
        frames.clear();
        cursor = 0;
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < frames.size();
    }

    public int cursor() {
        return cursor;
    }

    public int size() {
        return frames.size();
    }

    public List<UndoFrame> entries() {
        return Collections.unmodifiableList(frames);
    }
}
