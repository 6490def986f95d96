package com.glimpse.core.session;

import com.glimpse.core.document.ImageDocument;
import com.glimpse.core.history.UndoFrame;
import com.glimpse.core.image.Frame;

import java.util.List;

/**
 * Replays a history entry against the document. Snapshot entries exchange buffers with the
 * document, so the same code serves undo and redo.
 */
final class UndoApplier implements UndoFrame.Visitor<Void> {

    private final ImageDocument document;
    private final boolean forward;

    private UndoApplier(ImageDocument document, boolean forward) {
        this.document = document;
        this.forward = forward;
    }

    static UndoApplier reverse(ImageDocument document) {
        return new UndoApplier(document, false);
    }

    static UndoApplier replay(ImageDocument document) {
        return new UndoApplier(document, true);
    }

    @Override
    public Void visitRotate(UndoFrame.Rotate frame) {
        document.rotate(forward ? frame.quarterTurns() : -frame.quarterTurns());
        return null;
    }

    @Override
    public Void visitFlipHorizontal(UndoFrame.FlipHorizontal frame) {
        document.flipHorizontal();
        return null;
    }

    @Override
    public Void visitFlipVertical(UndoFrame.FlipVertical frame) {
        document.flipVertical();
        return null;
    }

    @Override
    public Void visitCrop(UndoFrame.Crop frame) {
        List<Frame> held = frame.swapFrames(document.frames());
        document.replaceFrames(held);
        document.swapRotation(frame.swapRotation(document.rotation()));
        return null;
    }

    @Override
    public Void visitResize(UndoFrame.Resize frame) {
        document.replaceFrames(frame.swapFrames(document.frames()));
        return null;
    }

    @Override
    public Void visitColor(UndoFrame.Color frame) {
        document.replaceFrames(frame.swapFrames(document.frames()));
        return null;
    }
}
