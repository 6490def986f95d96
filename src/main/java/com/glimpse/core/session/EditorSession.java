package com.glimpse.core.session;

import com.glimpse.core.cache.FrameCache;
import com.glimpse.core.document.CropGesture;
import com.glimpse.core.document.ImageDocument;
import com.glimpse.core.fs.ImageList;
import com.glimpse.core.history.UndoFrame;
import com.glimpse.core.history.UndoStack;
import com.glimpse.core.image.Frame;
import com.glimpse.core.ops.Op;
import com.glimpse.core.ops.OpQueue;
import com.glimpse.core.ops.Output;
import com.glimpse.logging.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * UI-side owner of the open document. Requests go out through {@link #queue(Op)}; results come
 * back through {@link #poll()}, the only place where the document, the image list, the frame
 * cache and the undo history change.
 */
public final class EditorSession implements AutoCloseable {

    private static final Logger LOGGER = AppLogger.get();

    private final OpQueue opQueue;
    private final CropGesture crop = new CropGesture();
    private final List<SessionListener> listeners = new ArrayList<>();

    private ImageDocument document;
    private Op inFlight;
    private UndoFrame savedTop;
    private double viewportWidth = 800;
    private double viewportHeight = 600;

    public EditorSession(OpQueue opQueue) {
        this.opQueue = Objects.requireNonNull(opQueue, "opQueue");
    }

    /**
     * Sends {@code op} to the worker with a snapshot of the open document.
     *
     * @return false when the queue rejected it
     */
    public boolean queue(Op op) {
        boolean accepted = opQueue.queue(op, document == null ? null : document.snapshot());
        if (accepted) {
            inFlight = op;
        }
        return accepted;
    }

    /**
     * Applies every finished output. Call once per UI tick; never blocks.
     *
     * @return number of outputs applied
     */
    public int poll() {
        int applied = 0;
        Optional<OpQueue.Polled> polled;
        while ((polled = opQueue.poll()).isPresent()) {
            OpQueue.Polled result = polled.get();
            Op source = inFlight;
            inFlight = null;
            result.output().accept(new OutputApplier(result.undoStack(), source));
            applied++;
            notifyListeners();
        }
        if (!opQueue.working()) {
            inFlight = null;
        }
        return applied;
    }

    public boolean working() {
        return opQueue.working();
    }

    /** An image is open and no operation is running. */
    public boolean viewAvailable() {
        return !opQueue.working() && document != null;
    }

    public Optional<ImageDocument> document() {
        return Optional.ofNullable(document);
    }

    /** The open document differs from the state last loaded or saved. */
    public boolean modified() {
        return document != null && historyTop() != savedTop;
    }

    public CropGesture crop() {
        return crop;
    }

    public UndoStack undoStack() {
        return opQueue.undoStack();
    }

    public ImageList imageList() {
        return opQueue.imageList();
    }

    public FrameCache cache() {
        return opQueue.cache();
    }

    public void setViewport(double width, double height) {
        viewportWidth = width;
        viewportHeight = height;
    }

    public void bestFit() {
        if (document != null) {
            document.bestFit(viewportWidth, viewportHeight);
        }
    }

    public void largestFit() {
        if (document != null) {
            document.largestFit(viewportWidth, viewportHeight);
        }
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void close() {
        opQueue.close();
    }

    private UndoFrame historyTop() {
        UndoStack stack = opQueue.undoStack();
        return stack.cursor() == 0 ? null : stack.entries().get(stack.cursor() - 1);
    }

    private void notifyListeners() {
        for (SessionListener listener : listeners) {
            listener.documentChanged(document);
        }
    }

    private final class OutputApplier implements Output.Visitor<Void> {
        private final UndoStack stack;
        private final Op source;

        OutputApplier(UndoStack stack, Op source) {
            this.stack = stack;
            this.source = source;
        }

        @Override
        public Void visitImageLoaded(Output.ImageLoaded output) {
            stack.clear();
            savedTop = null;
            ImageList list = opQueue.imageList();
            FrameCache cache = opQueue.cache();
            Path path = output.sourcePath();
            if (path != null) {
                boolean directoryChanged = list.changeDir(path, output.rebuildList());
                if (directoryChanged || output.rebuildList()) {
                    cache.clear();
                }
                cache.setCurrent(path);
                cache.insert(path, output.frames());
            } else {
                list.clear();
                cache.setCurrent(null);
            }
            document = new ImageDocument(output.frames(), path);
            document.bestFit(viewportWidth, viewportHeight);
            LOGGER.fine(() -> "Showing " + (path == null ? "pasted image" : path.toString()));
            return null;
        }

        @Override
        public Void visitFlipHorizontal(Output.FlipHorizontal output) {
            if (requireDocument(output)) {
                document.flipHorizontal();
                stack.push(new UndoFrame.FlipHorizontal());
            }
            return null;
        }

        @Override
        public Void visitFlipVertical(Output.FlipVertical output) {
            if (requireDocument(output)) {
                document.flipVertical();
                stack.push(new UndoFrame.FlipVertical());
            }
            return null;
        }

        @Override
        public Void visitRotate(Output.Rotate output) {
            if (requireDocument(output)) {
                document.rotate(output.quarterTurns());
                stack.push(new UndoFrame.Rotate(output.quarterTurns()));
            }
            return null;
        }

        @Override
        public Void visitResize(Output.Resize output) {
            if (requireDocument(output)) {
                List<Frame> replaced = document.replaceFrames(output.frames());
                stack.push(new UndoFrame.Resize(replaced));
                document.bestFit(viewportWidth, viewportHeight);
            }
            return null;
        }

        @Override
        public Void visitColor(Output.Color output) {
            if (requireDocument(output)) {
                List<Frame> replaced = document.replaceFrames(output.frames());
                stack.push(new UndoFrame.Color(replaced));
                document.resetPendingColor();
            }
            return null;
        }

        @Override
        public Void visitCrop(Output.Crop output) {
            if (requireDocument(output)) {
                List<Frame> replaced = document.replaceFrames(output.frames());
                document.swapRotation(0);
                stack.push(new UndoFrame.Crop(replaced, output.rotation()));
            }
            return null;
        }

        @Override
        public Void visitUndo(Output.Undo output) {
            if (document != null) {
                stack.undo().ifPresent(frame -> frame.accept(UndoApplier.reverse(document)));
            }
            return null;
        }

        @Override
        public Void visitRedo(Output.Redo output) {
            if (document != null) {
                stack.redo().ifPresent(frame -> frame.accept(UndoApplier.replay(document)));
            }
            return null;
        }

        @Override
        public Void visitClose(Output.Close output) {
            document = null;
            stack.clear();
            savedTop = null;
            opQueue.imageList().clear();
            crop.cancel();
            opQueue.cache().clear();
            LOGGER.fine("Document closed");
            return null;
        }

        @Override
        public Void visitDone(Output.Done output) {
            if (source instanceof Op.Save save) {
                onSaved(save.path());
            }
            return null;
        }

        private void onSaved(Path saved) {
            savedTop = historyTop();
            FrameCache cache = opQueue.cache();
            cache.remove(saved);
            ImageList list = opQueue.imageList();
            Path absolute = saved.toAbsolutePath().normalize();
            if (document != null && document.path() != null
                && list.directory().map(dir -> dir.equals(absolute.getParent())).orElse(false)) {
                list.changeDir(document.path(), true);
            }
        }

        private boolean requireDocument(Output output) {
            if (document == null) {
                LOGGER.warning(() -> "Dropping " + output.getClass().getSimpleName() + ": no document is open");
                return false;
            }
            return true;
        }
    }
}
