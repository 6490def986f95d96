package com.glimpse.core.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One still image of a document: the pixel buffer and how long it stays on screen.
 * A delay of zero marks a static image.
 */
public record Frame(BufferedImage image, int delayMillis) {

    public Frame {
        Objects.requireNonNull(image, "image");
        if (delayMillis < 0) {
            throw new IllegalArgumentException("Frame delay must not be negative: " + delayMillis);
        }
    }

    public static Frame still(BufferedImage image) {
        return new Frame(image, 0);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public Frame withImage(BufferedImage replacement) {
        return new Frame(replacement, delayMillis);
    }

    /** Approximate resident size of the pixel data. */
    public long byteSize() {
        int bands = image.getRaster().getNumBands();
        int bitsPerBand = image.getColorModel().getComponentSize(0);
        long bytesPerPixel = Math.max(1, (long) bands * Math.max(8, bitsPerBand) / 8);
        return (long) image.getWidth() * image.getHeight() * bytesPerPixel;
    }

    public static long byteSize(List<Frame> frames) {
        long total = 0;
        for (Frame frame : frames) {
            total += frame.byteSize();
        }
        return total;
    }

    /** True when both frames hold the same ARGB pixels and delay. */
    public boolean samePixels(Frame other) {
        if (other == null || delayMillis != other.delayMillis
            || width() != other.width() || height() != other.height()) {
            return false;
        }
        int w = width();
        int[] row = new int[w];
        int[] otherRow = new int[w];
        for (int y = 0; y < height(); y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            other.image.getRGB(0, y, w, 1, otherRow, 0, w);
            if (!Arrays.equals(row, otherRow)) {
                return false;
            }
        }
        return true;
    }
}
