package com.glimpse.core.image;

import com.glimpse.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageTransformsTest {

    @Test
    void normalizesQuarterTurnsIntoZeroToThree() {
        assertEquals(0, ImageTransforms.normalizeQuarterTurns(4));
        assertEquals(3, ImageTransforms.normalizeQuarterTurns(-1));
        assertEquals(1, ImageTransforms.normalizeQuarterTurns(-7));
        assertEquals(2, ImageTransforms.normalizeQuarterTurns(6));
    }

    @Test
    void rotatesClockwiseForPositiveTurns() {
        BufferedImage source = TestImages.pattern(3, 2);

        BufferedImage rotated = ImageTransforms.rotate(source, 1);

        assertEquals(2, rotated.getWidth());
        assertEquals(3, rotated.getHeight());
        // top-left of the source ends up top-right
        assertEquals(source.getRGB(0, 0), rotated.getRGB(1, 0));
        assertEquals(source.getRGB(0, 1), rotated.getRGB(0, 0));
        assertEquals(source.getRGB(2, 0), rotated.getRGB(1, 2));
    }

    @Test
    void fourQuarterTurnsRestoreThePixels() {
        Frame original = Frame.still(TestImages.pattern(5, 3));
        List<Frame> frames = List.of(original);
        for (int i = 0; i < 4; i++) {
            frames = ImageTransforms.rotate(frames, 1);
        }
        assertTrue(original.samePixels(frames.get(0)));
    }

    @Test
    void counterClockwiseUndoesClockwise() {
        BufferedImage source = TestImages.pattern(4, 7);
        BufferedImage back = ImageTransforms.rotate(ImageTransforms.rotate(source, 1), -1);
        assertTrue(Frame.still(source).samePixels(Frame.still(back)));
    }

    @Test
    void flipsMirrorAcrossTheExpectedAxis() {
        BufferedImage source = TestImages.pattern(4, 3);

        BufferedImage horizontal = ImageTransforms.flipHorizontal(source);
        BufferedImage vertical = ImageTransforms.flipVertical(source);

        assertEquals(source.getRGB(0, 1), horizontal.getRGB(3, 1));
        assertEquals(source.getRGB(2, 0), vertical.getRGB(2, 2));
        assertTrue(Frame.still(source).samePixels(Frame.still(ImageTransforms.flipHorizontal(horizontal))));
    }

    @Test
    void transformsProduceNewBuffers() {
        BufferedImage source = TestImages.pattern(2, 2);
        assertNotSame(source, ImageTransforms.rotate(source, 0));
        assertNotSame(source, ImageTransforms.copy(source));
    }

    @Test
    void cropClampsToTheImage() {
        List<Frame> frames = TestImages.still(TestImages.pattern(10, 8));

        List<Frame> cropped = ImageTransforms.crop(frames, new CropRect(6, 5, 20, 20));

        BufferedImage image = cropped.get(0).image();
        assertEquals(4, image.getWidth());
        assertEquals(3, image.getHeight());
        assertEquals(TestImages.pixel(6, 5), image.getRGB(0, 0));
        assertEquals(TestImages.pixel(9, 7), image.getRGB(3, 2));
    }

    @Test
    void cropOutsideTheImageIsRejected() {
        List<Frame> frames = TestImages.still(TestImages.pattern(10, 8));
        assertThrows(IllegalArgumentException.class,
            () -> ImageTransforms.crop(frames, new CropRect(12, 0, 5, 5)));
    }

    @Test
    void cropKeepsFrameDelays() {
        List<Frame> frames = List.of(
            new Frame(TestImages.pattern(6, 6), 40),
            new Frame(TestImages.pattern(6, 6), 90));

        List<Frame> cropped = ImageTransforms.crop(frames, new CropRect(1, 1, 3, 3));

        assertEquals(2, cropped.size());
        assertEquals(40, cropped.get(0).delayMillis());
        assertEquals(90, cropped.get(1).delayMillis());
    }

    @Test
    void resizeProducesTheRequestedSizeForEveryFilter() {
        List<Frame> frames = TestImages.still(TestImages.pattern(16, 9));
        for (ResampleFilter filter : ResampleFilter.values()) {
            BufferedImage out = ImageTransforms.resize(frames, 7, 20, filter).get(0).image();
            assertEquals(7, out.getWidth(), filter.displayName());
            assertEquals(20, out.getHeight(), filter.displayName());
        }
    }

    @Test
    void resizeKeepsAFlatColorFlat() {
        int teal = 0xFF208080;
        List<Frame> frames = TestImages.still(TestImages.solid(12, 12, teal));

        BufferedImage out = ImageTransforms.resize(frames, 5, 31, ResampleFilter.LANCZOS3).get(0).image();

        for (int y = 0; y < out.getHeight(); y++) {
            for (int x = 0; x < out.getWidth(); x++) {
                assertEquals(teal, out.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void fullDesaturationYieldsGray() {
        List<Frame> frames = TestImages.still(TestImages.solid(3, 3, 0xFFCC3311));

        int out = ImageTransforms.adjustColor(frames, new ColorAdjustment(0, 0, -100, 0)).get(0).image().getRGB(1, 1);

        int r = (out >> 16) & 0xFF;
        int g = (out >> 8) & 0xFF;
        int b = out & 0xFF;
        assertEquals(r, g);
        assertEquals(g, b);
    }

    @Test
    void fullLightnessYieldsWhite() {
        List<Frame> frames = TestImages.still(TestImages.pattern(4, 4));

        BufferedImage out = ImageTransforms.adjustColor(frames, new ColorAdjustment(0, 0, 0, 100)).get(0).image();

        assertEquals(0xFFFFFFFF, out.getRGB(2, 3));
    }

    @Test
    void colorAdjustmentClampsItsRanges() {
        ColorAdjustment adjustment = new ColorAdjustment(400, -250, 120, Float.NaN);
        assertEquals(180f, adjustment.hue());
        assertEquals(-100f, adjustment.contrast());
        assertEquals(100f, adjustment.saturation());
        assertEquals(0f, adjustment.lightness());
    }

    @Test
    void resampleFilterLooksUpByConstantOrDisplayName() {
        assertEquals(ResampleFilter.LANCZOS3, ResampleFilter.fromName("lanczos", ResampleFilter.NEAREST));
        assertEquals(ResampleFilter.GAUSSIAN, ResampleFilter.fromName("GAUSSIAN", ResampleFilter.NEAREST));
        assertEquals(ResampleFilter.NEAREST, ResampleFilter.fromName("bogus", ResampleFilter.NEAREST));
    }
}
