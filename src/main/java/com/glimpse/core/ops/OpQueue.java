package com.glimpse.core.ops;

import com.glimpse.core.cache.FrameCache;
import com.glimpse.core.fs.ImageList;
import com.glimpse.core.history.UndoStack;
import com.glimpse.core.image.Frame;
import com.glimpse.core.io.ImageCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-slot job dispatcher between the UI thread and one worker thread.
 *
 * <p>{@link #queue} accepts a request only while nothing is in flight; a call made while
 * {@link #working()} is true is rejected and returns {@code false}. {@link #poll()} never blocks
 * and hands back each completed job's output once. The image list, frame cache and undo stack
 * belong to the UI thread and are only touched from {@code queue} and {@code poll}.
 */
public final class OpQueue implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(OpQueue.class.getName());

    private final ImageCodec codec;
    private final ClipboardAccess clipboard;
    private final ErrorSink errorSink;
    private final ExecutorService worker;
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>(1);

    private final ImageList imageList = new ImageList();
    private final FrameCache cache;
    private final UndoStack undoStack;

    private boolean working;

    public OpQueue(ImageCodec codec, ClipboardAccess clipboard, ErrorSink errorSink,
                   FrameCache cache, UndoStack undoStack) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard");
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.undoStack = Objects.requireNonNull(undoStack, "undoStack");
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "op-worker");
            t.setDaemon(true);
            return t;
        };
        this.worker = Executors.newSingleThreadExecutor(tf);
    }

    /**
     * @param document snapshot of the open document, {@code null} when none is open
     * @return false when the request was rejected: a job is in flight, the op needs a document
     *     and none is open, or there is nowhere to navigate
     */
    public boolean queue(Op op, DocumentSnapshot document) {
        Objects.requireNonNull(op, "op");
        if (working) {
            LOGGER.fine(() -> "Rejected " + describe(op) + ": another operation is in flight");
            return false;
        }
        if (op.requiresDocument() && document == null) {
            LOGGER.fine(() -> "Rejected " + describe(op) + ": no image is open");
            return false;
        }

        Path target = null;
        if (op instanceof Op.Next || op instanceof Op.Prev) {
            Optional<Path> candidate = op instanceof Op.Next ? imageList.peekNext() : imageList.peekPrev();
            if (candidate.isEmpty()) {
                LOGGER.fine(() -> "Rejected " + describe(op) + ": no sibling images");
                return false;
            }
            target = candidate.get();
            Optional<List<Frame>> cached = cache.get(target);
            if (cached.isPresent()) {
                Path hit = target;
                LOGGER.fine(() -> "Serving " + hit.getFileName() + " from frame cache");
                working = true;
                completions.add(new Completion(op, new Output.ImageLoaded(cached.get(), hit, false)));
                return true;
            }
        }

        OpExecutor executor = new OpExecutor(codec, clipboard, document, target);
        working = true;
        try {
            worker.execute(() -> {
                Completion completion = new Completion(op, null);
                try {
                    completion = run(op, executor);
                } finally {
                    completions.add(completion);
                }
            });
        } catch (RejectedExecutionException ex) {
            working = false;
            LOGGER.log(Level.WARNING, "Worker is shut down; dropping " + describe(op), ex);
            return false;
        }
        return true;
    }

    /** True from the moment an op is accepted until its result has been polled. */
    public boolean working() {
        return working;
    }

    /**
     * Non-blocking. Returns the finished job's output at most once; empty while the job is still
     * running, when nothing was queued, or when the job failed (its error already went to the
     * error sink).
     */
    public Optional<Polled> poll() {
        Completion completion = completions.poll();
        if (completion == null) {
            return Optional.empty();
        }
        working = false;
        if (completion.output() == null) {
            return Optional.empty();
        }
        return Optional.of(new Polled(completion.output(), undoStack));
    }

    public ImageList imageList() {
        return imageList;
    }

    public FrameCache cache() {
        return cache;
    }

    public UndoStack undoStack() {
        return undoStack;
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException ex) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Completion run(Op op, OpExecutor executor) {
        Output output = null;
        try {
            output = op.accept(executor);
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, describe(op) + " failed", ex);
            report(userMessage(ex));
        } catch (OutOfMemoryError ex) {
            LOGGER.log(Level.SEVERE, describe(op) + " ran out of memory", ex);
            report("Not enough memory to complete " + describe(op));
        } catch (Error ex) {
            LOGGER.log(Level.SEVERE, describe(op) + " failed unexpectedly", ex);
            report(describe(op) + " failed: " + userMessage(ex));
        }
        return new Completion(op, output);
    }

    private void report(String message) {
        try {
            errorSink.report(message);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Error sink rejected message: " + message, ex);
        }
    }

    static String userMessage(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private static String describe(Op op) {
        return op.getClass().getSimpleName();
    }

    /** One completed job; {@code output} is null when the job failed. */
    private record Completion(Op op, Output output) {
    }

    /** A completed output together with the history it should be recorded in. */
    public record Polled(Output output, UndoStack undoStack) {
    }
}
