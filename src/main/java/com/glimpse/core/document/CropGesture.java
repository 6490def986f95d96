package com.glimpse.core.document;

import com.glimpse.core.image.CropRect;

import java.util.Optional;

/**
 * Rubber-band selection for a crop: armed by the user, grown by drag deltas and turned into an
 * image-space rectangle on release.
 */
public final class CropGesture {

    private boolean cropping;
    private boolean dragging;
    private double startX;
    private double startY;
    private double currentX;
    private double currentY;

    public void begin() {
        cropping = true;
        dragging = false;
    }

    public boolean isCropping() {
        return cropping;
    }

    public boolean isDragging() {
        return dragging;
    }

    /** Cursor is at {@code (x, y)} after moving by {@code (dx, dy)}. */
    public void drag(double x, double y, double dx, double dy) {
        if (!cropping) {
            return;
        }
        if (!dragging) {
            startX = x - dx;
            startY = y - dy;
            currentX = x;
            currentY = y;
            dragging = true;
        } else {
            currentX += dx;
            currentY += dy;
        }
    }

    /** Screen-space selection as {@code {x, y, width, height}} while dragging. */
    public Optional<double[]> selection() {
        if (!dragging) {
            return Optional.empty();
        }
        return Optional.of(new double[]{
            Math.min(startX, currentX), Math.min(startY, currentY),
            Math.abs(currentX - startX), Math.abs(currentY - startY)
        });
    }

    /** Ends the gesture and maps the selection into {@code document} pixels. */
    public Optional<CropRect> release(ImageDocument document) {
        if (!dragging || document == null) {
            return Optional.empty();
        }
        CropRect rect = document.screenToImage(startX, startY, currentX, currentY);
        cancel();
        return Optional.of(rect);
    }

    public void cancel() {
        cropping = false;
        dragging = false;
    }
}
