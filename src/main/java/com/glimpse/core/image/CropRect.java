package com.glimpse.core.image;

/**
 * Crop region in image-space pixels of the displayed (rotated) image.
 */
public record CropRect(int x, int y, int width, int height) {

    public static CropRect fromCorners(int x1, int y1, int x2, int y2) {
        return new CropRect(Math.min(x1, x2), Math.min(y1, y2), Math.abs(x2 - x1), Math.abs(y2 - y1));
    }

    /** Intersects this rect with {@code [0, imageWidth) x [0, imageHeight)}. */
    public CropRect clampTo(int imageWidth, int imageHeight) {
        int left = clamp(x, imageWidth);
        int top = clamp(y, imageHeight);
        int right = clamp((long) x + width, imageWidth);
        int bottom = clamp((long) y + height, imageHeight);
        return new CropRect(left, top, Math.max(0, right - left), Math.max(0, bottom - top));
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    private static int clamp(long value, int max) {
        return (int) Math.max(0, Math.min(value, max));
    }
}
