package com.glimpse.core.history;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UndoStackTest {

    private final UndoFrame a = new UndoFrame.Rotate(1);
    private final UndoFrame b = new UndoFrame.FlipHorizontal();
    private final UndoFrame c = new UndoFrame.FlipVertical();

    @Test
    void pushAfterUndoDiscardsTheRedoTail() {
        UndoStack stack = new UndoStack();
        stack.push(a);
        stack.push(b);
        stack.undo();

        stack.push(c);

        assertEquals(List.of(a, c), stack.entries());
        assertEquals(2, stack.cursor());
        assertFalse(stack.canRedo());
    }

    @Test
    void undoAndRedoWalkTheCursor() {
        UndoStack stack = new UndoStack();
        stack.push(a);
        stack.push(b);

        assertSame(b, stack.undo().orElseThrow());
        assertSame(a, stack.undo().orElseThrow());
        assertTrue(stack.undo().isEmpty());
        assertEquals(0, stack.cursor());

        assertSame(a, stack.redo().orElseThrow());
        assertSame(b, stack.redo().orElseThrow());
        assertTrue(stack.redo().isEmpty());
        assertEquals(2, stack.cursor());
    }

    @Test
    void emptyStackIsANoOp() {
        UndoStack stack = new UndoStack();
        assertTrue(stack.undo().isEmpty());
        assertTrue(stack.redo().isEmpty());
        assertEquals(0, stack.cursor());
    }

    @Test
    void limitDropsTheOldestEntries() {
        UndoStack stack = new UndoStack(2);
        stack.push(a);
        stack.push(b);
        stack.push(c);

        assertEquals(List.of(b, c), stack.entries());
        assertEquals(2, stack.cursor());
    }

    @Test
    void clearResetsEverything() {
        UndoStack stack = new UndoStack();
        stack.push(a);
        stack.clear();
        assertEquals(0, stack.size());
        assertFalse(stack.canUndo());
    }
}
