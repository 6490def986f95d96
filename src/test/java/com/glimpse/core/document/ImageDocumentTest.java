package com.glimpse.core.document;

import com.glimpse.TestImages;
import com.glimpse.core.image.CropRect;
import com.glimpse.core.image.Frame;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageDocumentTest {

    @Test
    void rotationCounterWrapsAndSwapsDisplaySize() {
        ImageDocument doc = document(40, 10);

        doc.rotate(1);
        assertEquals(1, doc.rotation());
        assertEquals(10, doc.displayWidth());
        assertEquals(40, doc.displayHeight());

        doc.rotate(-2);
        assertEquals(3, doc.rotation());
        doc.rotate(1);
        assertEquals(0, doc.rotation());
        assertEquals(40, doc.displayWidth());
    }

    @Test
    void horizontalFlipFollowsTheDisplayedOrientation() {
        ImageDocument doc = document(4, 3);
        BufferedImage before = doc.frames().get(0).image();
        doc.rotate(1);

        doc.flipHorizontal();

        // sideways: a horizontal mirror on screen mirrors the raw rows
        BufferedImage after = doc.frames().get(0).image();
        assertEquals(before.getRGB(1, 0), after.getRGB(1, 2));
    }

    @Test
    void bestFitNeverEnlarges() {
        ImageDocument small = document(400, 200);
        small.bestFit(800, 600);
        assertEquals(1.0, small.scale());
        assertEquals(400.0, small.positionX());
        assertEquals(300.0, small.positionY());

        ImageDocument wide = document(1600, 600);
        wide.bestFit(800, 600);
        assertEquals(0.5, wide.scale());
    }

    @Test
    void largestFitEnlarges() {
        ImageDocument doc = document(100, 50);
        doc.largestFit(800, 600);
        assertEquals(8.0, doc.scale());
    }

    @Test
    void fitUsesTheRotatedSize() {
        ImageDocument doc = document(1200, 300);
        doc.rotate(1);
        doc.bestFit(800, 600);
        assertEquals(0.5, doc.scale());
    }

    @Test
    void zoomKeepsTheAnchorFixed() {
        ImageDocument doc = document(400, 200);
        doc.bestFit(800, 600);

        doc.zoom(1, 0, 0);

        assertEquals(1.1, doc.scale(), 1e-9);
        assertEquals(440.0, doc.positionX(), 1e-9);
        assertEquals(330.0, doc.positionY(), 1e-9);
    }

    @Test
    void zoomOutStopsAtTheMinimumVisibleSize() {
        ImageDocument doc = document(100, 100);

        doc.zoom(-5, 50, 50);

        assertEquals(1.0, doc.scale());
    }

    @Test
    void screenRectangleMapsToImagePixels() {
        ImageDocument doc = document(400, 200);
        doc.bestFit(800, 600);

        CropRect rect = doc.screenToImage(260, 250, 210, 220);

        assertEquals(new CropRect(10, 20, 50, 30), rect);
    }

    @Test
    void animationAdvancesByFrameDelay() {
        ImageDocument doc = new ImageDocument(List.of(
            new Frame(TestImages.pattern(2, 2), 50),
            new Frame(TestImages.pattern(2, 2), 0)), null);

        assertEquals(20, doc.advanceAnimation(30));
        assertEquals(0, doc.frameIndex());
        assertEquals(100, doc.advanceAnimation(20));
        assertEquals(1, doc.frameIndex());
        doc.advanceAnimation(100);
        assertEquals(0, doc.frameIndex());
    }

    @Test
    void stillImagesDoNotAnimate() {
        assertEquals(-1, document(2, 2).advanceAnimation(1000));
    }

    @Test
    void titleIsTheFileName() {
        assertEquals("holiday.png", new ImageDocument(frames(2, 2), Path.of("pics", "holiday.png")).title());
        assertEquals("", new ImageDocument(frames(2, 2), null).title());
    }

    @Test
    void refusesEmptyFrameLists() {
        assertThrows(IllegalArgumentException.class, () -> new ImageDocument(List.of(), null));
        ImageDocument doc = document(2, 2);
        assertThrows(IllegalArgumentException.class, () -> doc.replaceFrames(List.of()));
    }

    private static ImageDocument document(int width, int height) {
        return new ImageDocument(frames(width, height), null);
    }

    private static List<Frame> frames(int width, int height) {
        return TestImages.still(TestImages.pattern(width, height));
    }
}
