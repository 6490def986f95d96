package com.glimpse.core.document;

import com.glimpse.core.image.ColorAdjustment;
import com.glimpse.core.image.CropRect;
import com.glimpse.core.image.Frame;
import com.glimpse.core.image.ImageTransforms;
import com.glimpse.core.ops.DocumentSnapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The open image and how it is shown: frames, rotation counter, zoom, on-screen position,
 * pending color-slider values and the animation cursor. Frames are stored unrotated; the
 * rotation counter says how the view turns them.
 */
public final class ImageDocument {

    static final double MIN_VISIBLE_SIZE = 100.0;
    static final int DEFAULT_ANIMATION_DELAY_MS = 100;

    private List<Frame> frames;
    private final Path path;
    private int rotation;
    private double scale = 1.0;
    private double positionX;
    private double positionY;
    private ColorAdjustment pendingColor = ColorAdjustment.NEUTRAL;
    private int frameIndex;
    private long frameElapsedMillis;

    public ImageDocument(List<Frame> frames, Path path) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one frame");
        }
        this.frames = List.copyOf(frames);
        this.path = path;
    }

    public List<Frame> frames() {
        return frames;
    }

    /** Installs {@code next} and returns the frames it replaced. */
    public List<Frame> replaceFrames(List<Frame> next) {
        if (next == null || next.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one frame");
        }
        List<Frame> previous = frames;
        frames = List.copyOf(next);
        if (frameIndex >= frames.size()) {
            frameIndex = 0;
            frameElapsedMillis = 0;
        }
        return previous;
    }

    /** {@code null} for pasted images. */
    public Path path() {
        return path;
    }

    public String title() {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        return path.getFileName().toString();
    }

    public int rotation() {
        return rotation;
    }

    public void rotate(int quarterTurns) {
        rotation = ImageTransforms.normalizeQuarterTurns(rotation + quarterTurns);
    }

    /** Sets the rotation counter and returns the previous value. */
    public int swapRotation(int next) {
        int previous = rotation;
        rotation = ImageTransforms.normalizeQuarterTurns(next);
        return previous;
    }

    /** Mirrors the image as displayed, so the raw axis depends on the rotation. */
    public void flipHorizontal() {
        frames = isSideways() ? ImageTransforms.flipVertical(frames) : ImageTransforms.flipHorizontal(frames);
    }

    public void flipVertical() {
        frames = isSideways() ? ImageTransforms.flipHorizontal(frames) : ImageTransforms.flipVertical(frames);
    }

    public int width() {
        return frames.get(0).width();
    }

    public int height() {
        return frames.get(0).height();
    }

    public int displayWidth() {
        return isSideways() ? height() : width();
    }

    public int displayHeight() {
        return isSideways() ? width() : height();
    }

    public double scale() {
        return scale;
    }

    public void setZoomFactor(double factor) {
        if (factor > 0) {
            scale = factor;
        }
    }

    public double scaledWidth() {
        return displayWidth() * scale;
    }

    public double scaledHeight() {
        return displayHeight() * scale;
    }

    public double positionX() {
        return positionX;
    }

    public double positionY() {
        return positionY;
    }

    /** Sets the on-screen position of the image center. */
    public void moveTo(double x, double y) {
        positionX = x;
        positionY = y;
    }

    public void pan(double dx, double dy) {
        positionX += dx;
        positionY += dy;
    }

    /** Fits the image into the viewport without enlarging it. */
    public void bestFit(double viewportWidth, double viewportHeight) {
        scale = Math.min(fitScale(viewportWidth, viewportHeight), 1.0);
        moveTo(viewportWidth / 2.0, viewportHeight / 2.0);
    }

    /** Fits the image into the viewport, enlarging it if needed. */
    public void largestFit(double viewportWidth, double viewportHeight) {
        scale = fitScale(viewportWidth, viewportHeight);
        moveTo(viewportWidth / 2.0, viewportHeight / 2.0);
    }

    /**
     * Zooms by {@code steps} tenths of the current scale, keeping the point under the anchor
     * fixed. Zooming out stops once the image would shrink below a minimum on-screen size.
     */
    public void zoom(double steps, double anchorX, double anchorY) {
        double oldScale = scale;
        scale += scale * steps / 10.0;
        if ((scaledWidth() < MIN_VISIBLE_SIZE || scaledHeight() < MIN_VISIBLE_SIZE)
            && oldScale >= scale && scale < 1.0) {
            scale = Math.min(oldScale, 1.0);
            return;
        }
        double factor = (oldScale - scale) / oldScale;
        positionX -= (positionX - anchorX) * factor;
        positionY -= (positionY - anchorY) * factor;
    }

    /**
     * Maps two screen points to a crop rectangle in displayed image pixels. The result may
     * extend past the image; the crop clamps it.
     */
    public CropRect screenToImage(double x1, double y1, double x2, double y2) {
        double left = positionX - scaledWidth() / 2.0;
        double top = positionY - scaledHeight() / 2.0;
        int ix1 = (int) Math.floor((Math.min(x1, x2) - left) / scale);
        int iy1 = (int) Math.floor((Math.min(y1, y2) - top) / scale);
        int ix2 = (int) Math.ceil((Math.max(x1, x2) - left) / scale);
        int iy2 = (int) Math.ceil((Math.max(y1, y2) - top) / scale);
        return CropRect.fromCorners(ix1, iy1, ix2, iy2);
    }

    public ColorAdjustment pendingColor() {
        return pendingColor;
    }

    public void setPendingColor(ColorAdjustment adjustment) {
        pendingColor = Objects.requireNonNull(adjustment);
    }

    public void resetPendingColor() {
        pendingColor = ColorAdjustment.NEUTRAL;
    }

    public boolean isAnimated() {
        return frames.size() > 1;
    }

    public int frameIndex() {
        return frameIndex;
    }

    public Frame currentFrame() {
        return frames.get(frameIndex);
    }

    /**
     * Advances playback by {@code elapsedMillis}.
     *
     * @return milliseconds until the next frame change, or -1 for still images
     */
    public long advanceAnimation(long elapsedMillis) {
        if (!isAnimated()) {
            return -1;
        }
        frameElapsedMillis += Math.max(0, elapsedMillis);
        long delay = delayOf(currentFrame());
        while (frameElapsedMillis >= delay) {
            frameElapsedMillis -= delay;
            frameIndex = (frameIndex + 1) % frames.size();
            delay = delayOf(currentFrame());
        }
        return delay - frameElapsedMillis;
    }

    public DocumentSnapshot snapshot() {
        return new DocumentSnapshot(frames, rotation, path);
    }

    private boolean isSideways() {
        return rotation % 2 != 0;
    }

    private double fitScale(double viewportWidth, double viewportHeight) {
        return Math.min(viewportWidth / displayWidth(), viewportHeight / displayHeight());
    }

    private static long delayOf(Frame frame) {
        return frame.delayMillis() > 0 ? frame.delayMillis() : DEFAULT_ANIMATION_DELAY_MS;
    }
}
