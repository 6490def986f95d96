package com.glimpse.core.image;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Pixel transforms applied frame by frame. Every method allocates new buffers; inputs are
 * never modified, so frame sets may be shared between the document, the cache and the undo
 * history.
 */
public final class ImageTransforms {

    private ImageTransforms() {
    }

    /** Normalizes a signed quarter-turn count to {@code 0..3}. */
    public static int normalizeQuarterTurns(int quarterTurns) {
        return Math.floorMod(quarterTurns, 4);
    }

    public static List<Frame> rotate(List<Frame> frames, int quarterTurns) {
        int turns = normalizeQuarterTurns(quarterTurns);
        if (turns == 0) {
            return List.copyOf(frames);
        }
        return map(frames, image -> rotate(image, turns));
    }

    public static List<Frame> flipHorizontal(List<Frame> frames) {
        return map(frames, ImageTransforms::flipHorizontal);
    }

    public static List<Frame> flipVertical(List<Frame> frames) {
        return map(frames, ImageTransforms::flipVertical);
    }

    /**
     * Crops every frame to the same region. The region is clamped to the first frame's bounds.
     *
     * @throws IllegalArgumentException when nothing is left after clamping
     */
    public static List<Frame> crop(List<Frame> frames, CropRect rect) {
        if (frames.isEmpty()) {
            return List.of();
        }
        Frame first = frames.get(0);
        CropRect clamped = rect.clampTo(first.width(), first.height());
        if (clamped.isEmpty()) {
            throw new IllegalArgumentException("Crop region " + rect + " lies outside the image");
        }
        return map(frames, image -> crop(image, clamped.clampTo(image.getWidth(), image.getHeight())));
    }

    public static List<Frame> resize(List<Frame> frames, int width, int height, ResampleFilter filter) {
        return map(frames, image -> Resampler.resize(image, width, height, filter));
    }

    public static List<Frame> adjustColor(List<Frame> frames, ColorAdjustment adjustment) {
        return map(frames, image -> ColorAdjuster.apply(image, adjustment));
    }

    public static BufferedImage rotate(BufferedImage source, int quarterTurns) {
        int turns = normalizeQuarterTurns(quarterTurns);
        int w = source.getWidth();
        int h = source.getHeight();
        if (turns == 0) {
            return copy(source);
        }
        boolean swap = turns % 2 != 0;
        Raster src = source.getRaster();
        WritableRaster dst = compatibleRaster(source, swap ? h : w, swap ? w : h);
        int[] pixel = new int[src.getNumBands()];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                src.getPixel(x, y, pixel);
                switch (turns) {
                    case 1 -> dst.setPixel(h - 1 - y, x, pixel);
                    case 2 -> dst.setPixel(w - 1 - x, h - 1 - y, pixel);
                    default -> dst.setPixel(y, w - 1 - x, pixel);
                }
            }
        }
        return wrap(source, dst);
    }

    public static BufferedImage flipHorizontal(BufferedImage source) {
        int w = source.getWidth();
        int h = source.getHeight();
        Raster src = source.getRaster();
        WritableRaster dst = compatibleRaster(source, w, h);
        int bands = src.getNumBands();
        int[] row = new int[w * bands];
        int[] mirrored = new int[w * bands];
        for (int y = 0; y < h; y++) {
            src.getPixels(0, y, w, 1, row);
            for (int x = 0; x < w; x++) {
                System.arraycopy(row, x * bands, mirrored, (w - 1 - x) * bands, bands);
            }
            dst.setPixels(0, y, w, 1, mirrored);
        }
        return wrap(source, dst);
    }

    public static BufferedImage flipVertical(BufferedImage source) {
        int w = source.getWidth();
        int h = source.getHeight();
        Raster src = source.getRaster();
        WritableRaster dst = compatibleRaster(source, w, h);
        int[] row = new int[w * src.getNumBands()];
        for (int y = 0; y < h; y++) {
            src.getPixels(0, y, w, 1, row);
            dst.setPixels(0, h - 1 - y, w, 1, row);
        }
        return wrap(source, dst);
    }

    public static BufferedImage crop(BufferedImage source, CropRect rect) {
        WritableRaster dst = compatibleRaster(source, rect.width(), rect.height());
        dst.setRect(-rect.x(), -rect.y(), source.getRaster());
        return wrap(source, dst);
    }

    public static BufferedImage copy(BufferedImage source) {
        WritableRaster dst = compatibleRaster(source, source.getWidth(), source.getHeight());
        dst.setRect(source.getRaster());
        return wrap(source, dst);
    }

    private static List<Frame> map(List<Frame> frames, UnaryOperator<BufferedImage> op) {
        List<Frame> out = new ArrayList<>(frames.size());
        for (Frame frame : frames) {
            out.add(frame.withImage(op.apply(frame.image())));
        }
        return List.copyOf(out);
    }

    private static WritableRaster compatibleRaster(BufferedImage source, int width, int height) {
        return source.getColorModel().createCompatibleWritableRaster(width, height);
    }

    private static BufferedImage wrap(BufferedImage source, WritableRaster raster) {
        ColorModel model = source.getColorModel();
        return new BufferedImage(model, raster, model.isAlphaPremultiplied(), null);
    }
}
