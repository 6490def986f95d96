package com.glimpse.core.document;

import com.glimpse.TestImages;
import com.glimpse.core.image.CropRect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CropGestureTest {

    @Test
    void firstDragAnchorsAtThePressPoint() {
        CropGesture crop = new CropGesture();
        crop.begin();

        crop.drag(110, 120, 10, 20);
        crop.drag(115, 125, 5, 5);

        assertArrayEquals(new double[]{100, 100, 15, 25}, crop.selection().orElseThrow());
    }

    @Test
    void dragIsIgnoredUntilArmed() {
        CropGesture crop = new CropGesture();
        crop.drag(10, 10, 5, 5);
        assertFalse(crop.isDragging());
        assertTrue(crop.selection().isEmpty());
    }

    @Test
    void releaseMapsIntoTheDocumentAndEndsTheGesture() {
        ImageDocument doc = new ImageDocument(TestImages.still(TestImages.pattern(400, 200)), null);
        doc.bestFit(800, 600);
        CropGesture crop = new CropGesture();
        crop.begin();
        crop.drag(260, 250, 50, 30);

        CropRect rect = crop.release(doc).orElseThrow();

        assertEquals(new CropRect(10, 20, 50, 30), rect);
        assertFalse(crop.isCropping());
        assertTrue(crop.release(doc).isEmpty());
    }
}
