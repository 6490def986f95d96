package com.glimpse.core.ops;

import com.glimpse.TestImages;
import com.glimpse.core.cache.FrameCache;
import com.glimpse.core.history.UndoStack;
import com.glimpse.core.image.Frame;
import com.glimpse.core.image.ResampleFilter;
import com.glimpse.core.io.ImageCodec;
import com.glimpse.core.io.ImageFormat;
import com.glimpse.core.io.StandardImageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpQueueTest {

    @TempDir
    Path tempDir;

    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final FakeClipboard clipboard = new FakeClipboard();
    private OpQueue queue;

    @AfterEach
    void shutDown() {
        if (queue != null) {
            queue.close();
        }
    }

    @Test
    void workingIsTrueUntilTheResultIsPolled() throws Exception {
        queue = newQueue(new StandardImageCodec());
        Path png = TestImages.writePng(tempDir.resolve("a.png"), 3, 3);

        assertTrue(queue.queue(new Op.LoadPath(png, false), null));
        assertTrue(queue.working());

        Output output = await(queue).orElseThrow().output();

        assertFalse(queue.working());
        Output.ImageLoaded loaded = assertInstanceOf(Output.ImageLoaded.class, output);
        assertEquals(png, loaded.sourcePath());
        assertTrue(queue.poll().isEmpty(), "a result is delivered once");
    }

    @Test
    void rejectsWhileAnotherOpIsInFlight() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ImageCodec blocking = new StubCodec() {
            @Override
            public List<Frame> decode(Path path) throws IOException {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return TestImages.still(TestImages.pattern(2, 2));
            }
        };
        queue = newQueue(blocking);

        assertTrue(queue.queue(new Op.LoadPath(tempDir.resolve("slow.png"), false), null));
        assertFalse(queue.queue(new Op.LoadPath(tempDir.resolve("other.png"), false), null));
        assertFalse(queue.queue(new Op.Close(), null));

        release.countDown();
        assertTrue(await(queue).isPresent());
        assertTrue(queue.queue(new Op.Close(), null));
    }

    @Test
    void failuresGoToTheErrorSinkAndClearWorking() throws Exception {
        queue = newQueue(new StandardImageCodec());
        Path garbage = Files.writeString(tempDir.resolve("broken.png"), "not an image");

        assertTrue(queue.queue(new Op.LoadPath(garbage, false), null));

        assertTrue(await(queue).isEmpty());
        assertFalse(queue.working());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("broken.png"), errors.get(0));
    }

    @Test
    void workerErrorIsReportedAndFreesTheQueue() throws Exception {
        queue = newQueue(new StubCodec() {
            @Override
            public List<Frame> decode(Path path) {
                throw new NoClassDefFoundError("org/apache/batik/Missing");
            }
        });

        assertTrue(queue.queue(new Op.LoadPath(tempDir.resolve("a.svg"), false), null));

        assertTrue(await(queue).isEmpty());
        assertFalse(queue.working());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("org/apache/batik/Missing"), errors.get(0));
        assertTrue(queue.queue(new Op.Close(), null));
    }

    @Test
    void throwingErrorSinkStillFreesTheQueue() throws Exception {
        ErrorSink failing = message -> {
            throw new IllegalStateException("sink is gone");
        };
        queue = new OpQueue(new StandardImageCodec(), clipboard, failing,
                new FrameCache(8, Long.MAX_VALUE), new UndoStack());
        Path garbage = Files.writeString(tempDir.resolve("broken.png"), "not an image");

        assertTrue(queue.queue(new Op.LoadPath(garbage, false), null));

        assertTrue(await(queue).isEmpty());
        assertFalse(queue.working());
        assertTrue(queue.queue(new Op.Close(), null));
    }

    @Test
    void documentOpsNeedAnOpenDocument() {
        queue = newQueue(new StandardImageCodec());

        assertFalse(queue.queue(new Op.Rotate(1), null));
        assertFalse(queue.queue(new Op.Save(tempDir.resolve("x.png")), null));
        assertFalse(queue.working());
    }

    @Test
    void navigationWithoutAListIsRejected() {
        queue = newQueue(new StandardImageCodec());
        DocumentSnapshot pasted = new DocumentSnapshot(TestImages.still(TestImages.pattern(2, 2)), 0, null);

        assertFalse(queue.queue(new Op.Next(), pasted));
        assertFalse(queue.queue(new Op.Prev(), pasted));
    }

    @Test
    void cachedNeighbourCompletesWithoutDecoding() throws Exception {
        AtomicInteger decodes = new AtomicInteger();
        StandardImageCodec real = new StandardImageCodec();
        queue = newQueue(new StubCodec() {
            @Override
            public List<Frame> decode(Path path) throws IOException {
                decodes.incrementAndGet();
                return real.decode(path);
            }
        });
        Path a = TestImages.writePng(tempDir.resolve("a.png"), 2, 2);
        Path b = TestImages.writePng(tempDir.resolve("b.png"), 2, 2);
        queue.imageList().changeDir(a, false);
        List<Frame> cached = TestImages.still(TestImages.pattern(2, 2));
        queue.cache().insert(b, cached);

        assertTrue(queue.queue(new Op.Next(), snapshotOf(a)));

        Output.ImageLoaded loaded = assertInstanceOf(Output.ImageLoaded.class, queue.poll().orElseThrow().output());
        assertEquals(b.toAbsolutePath().normalize(), loaded.sourcePath());
        assertEquals(cached, loaded.frames());
        assertEquals(0, decodes.get());
        assertFalse(queue.working());
    }

    @Test
    void navigationDecodesAnUncachedNeighbour() throws Exception {
        queue = newQueue(new StandardImageCodec());
        Path a = TestImages.writePng(tempDir.resolve("a.png"), 2, 2);
        Path b = TestImages.writePng(tempDir.resolve("b.png"), 5, 4);
        queue.imageList().changeDir(b, false);

        assertTrue(queue.queue(new Op.Prev(), snapshotOf(b)));

        Output.ImageLoaded loaded = assertInstanceOf(Output.ImageLoaded.class, await(queue).orElseThrow().output());
        assertEquals(a.toAbsolutePath().normalize(), loaded.sourcePath());
        assertEquals(2, loaded.frames().get(0).width());
    }

    @Test
    void saveBakesTheRotationIn() throws Exception {
        queue = newQueue(new StandardImageCodec());
        Path out = tempDir.resolve("rotated.png");
        DocumentSnapshot doc = new DocumentSnapshot(TestImages.still(TestImages.pattern(6, 2)), 1, null);

        assertTrue(queue.queue(new Op.Save(out), doc));

        assertInstanceOf(Output.Done.class, await(queue).orElseThrow().output());
        BufferedImage saved = new StandardImageCodec().decode(out).get(0).image();
        assertEquals(2, saved.getWidth());
        assertEquals(6, saved.getHeight());
    }

    @Test
    void saveToAnUnknownExtensionFails() throws Exception {
        queue = newQueue(new StandardImageCodec());
        DocumentSnapshot doc = new DocumentSnapshot(TestImages.still(TestImages.pattern(2, 2)), 0, null);

        assertTrue(queue.queue(new Op.Save(tempDir.resolve("picture.xyz")), doc));

        assertTrue(await(queue).isEmpty());
        assertEquals(1, errors.size());
        assertFalse(Files.exists(tempDir.resolve("picture.xyz")));
    }

    @Test
    void copyPutsTheDisplayedImageOnTheClipboard() throws Exception {
        queue = newQueue(new StandardImageCodec());
        DocumentSnapshot doc = new DocumentSnapshot(TestImages.still(TestImages.pattern(7, 3)), 3, null);

        assertTrue(queue.queue(new Op.Copy(), doc));
        await(queue);

        assertEquals(3, clipboard.stored.getWidth());
        assertEquals(7, clipboard.stored.getHeight());
    }

    @Test
    void pasteLoadsAnUntitledImage() throws Exception {
        queue = newQueue(new StandardImageCodec());
        clipboard.stored = TestImages.pattern(4, 4);

        assertTrue(queue.queue(new Op.Paste(), null));

        Output.ImageLoaded loaded = assertInstanceOf(Output.ImageLoaded.class, await(queue).orElseThrow().output());
        assertNull(loaded.sourcePath());
        assertEquals(4, loaded.frames().get(0).width());
    }

    @Test
    void pasteWithoutAnImageReportsAnError() throws Exception {
        queue = newQueue(new StandardImageCodec());

        assertTrue(queue.queue(new Op.Paste(), null));

        assertTrue(await(queue).isEmpty());
        assertEquals(List.of("Clipboard does not contain an image"), errors);
    }

    @Test
    void resizeUsesDisplayedOrientation() throws Exception {
        queue = newQueue(new StandardImageCodec());
        DocumentSnapshot doc = new DocumentSnapshot(TestImages.still(TestImages.pattern(8, 4)), 1, null);

        assertTrue(queue.queue(new Op.Resize(2, 6, ResampleFilter.TRIANGLE), doc));

        Output.Resize resized = assertInstanceOf(Output.Resize.class, await(queue).orElseThrow().output());
        // stored unrotated: displayed 2x6 is raw 6x2
        assertEquals(6, resized.frames().get(0).width());
        assertEquals(2, resized.frames().get(0).height());
    }

    @Test
    void userMessageFallsBackToTheExceptionType() {
        assertEquals("IOException", OpQueue.userMessage(new IOException()));
        assertEquals("boom", OpQueue.userMessage(new IllegalStateException("boom")));
    }

    private OpQueue newQueue(ImageCodec codec) {
        return new OpQueue(codec, clipboard, errors::add, new FrameCache(8, Long.MAX_VALUE), new UndoStack());
    }

    private DocumentSnapshot snapshotOf(Path path) throws IOException {
        return new DocumentSnapshot(new StandardImageCodec().decode(path), 0, path);
    }

    static Optional<OpQueue.Polled> await(OpQueue queue) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (queue.working() && System.nanoTime() < deadline) {
            Optional<OpQueue.Polled> polled = queue.poll();
            if (polled.isPresent()) {
                return polled;
            }
            Thread.sleep(5);
        }
        return Optional.empty();
    }

    private abstract static class StubCodec implements ImageCodec {
        @Override
        public void encode(Path path, ImageFormat format, List<Frame> frames) throws IOException {
            throw new IOException("not supported in this test");
        }
    }

    private static final class FakeClipboard implements ClipboardAccess {
        volatile BufferedImage stored;

        @Override
        public void writeImage(BufferedImage image) {
            stored = image;
        }

        @Override
        public BufferedImage readImage() throws IOException {
            if (stored == null) {
                throw new ClipboardException("Clipboard does not contain an image");
            }
            return stored;
        }
    }
}
