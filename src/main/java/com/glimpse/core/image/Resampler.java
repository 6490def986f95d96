package com.glimpse.core.image;

import java.awt.image.BufferedImage;

/**
 * Separable convolution resampler. Scales the kernel by the reduction ratio when shrinking so
 * every source pixel contributes.
 */
final class Resampler {

    private Resampler() {
    }

    static BufferedImage resize(BufferedImage source, int width, int height, ResampleFilter filter) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        int srcW = source.getWidth();
        int srcH = source.getHeight();
        int[] pixels = source.getRGB(0, 0, srcW, srcH, null, 0, srcW);

        float[] premultiplied = premultiply(pixels);
        float[] horizontal = new float[width * srcH * 4];
        Kernel columns = Kernel.build(srcW, width, filter);
        for (int y = 0; y < srcH; y++) {
            for (int x = 0; x < width; x++) {
                accumulate(premultiplied, (y * srcW) * 4, 4, columns, x, horizontal, (y * width + x) * 4);
            }
        }

        float[] vertical = new float[width * height * 4];
        Kernel rows = Kernel.build(srcH, height, filter);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                accumulate(horizontal, x * 4, width * 4, rows, y, vertical, (y * width + x) * 4);
            }
        }

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, width, height, unpremultiply(vertical), 0, width);
        return out;
    }

    private static void accumulate(float[] src, int base, int stride, Kernel kernel, int index,
                                   float[] dst, int dstOffset) {
        int start = kernel.starts[index];
        double[] weights = kernel.weights[index];
        double a = 0, r = 0, g = 0, b = 0;
        for (int k = 0; k < weights.length; k++) {
            int offset = base + (start + k) * stride;
            double w = weights[k];
            a += src[offset] * w;
            r += src[offset + 1] * w;
            g += src[offset + 2] * w;
            b += src[offset + 3] * w;
        }
        dst[dstOffset] = (float) a;
        dst[dstOffset + 1] = (float) r;
        dst[dstOffset + 2] = (float) g;
        dst[dstOffset + 3] = (float) b;
    }

    private static float[] premultiply(int[] argb) {
        float[] out = new float[argb.length * 4];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            float a = ((p >>> 24) & 0xFF) / 255f;
            out[i * 4] = a;
            out[i * 4 + 1] = ((p >> 16) & 0xFF) * a;
            out[i * 4 + 2] = ((p >> 8) & 0xFF) * a;
            out[i * 4 + 3] = (p & 0xFF) * a;
        }
        return out;
    }

    private static int[] unpremultiply(float[] values) {
        int[] out = new int[values.length / 4];
        for (int i = 0; i < out.length; i++) {
            float a = values[i * 4];
            if (a <= 0f) {
                out[i] = 0;
                continue;
            }
            int alpha = clampByte(a * 255f);
            int r = clampByte(values[i * 4 + 1] / a);
            int g = clampByte(values[i * 4 + 2] / a);
            int b = clampByte(values[i * 4 + 3] / a);
            out[i] = (alpha << 24) | (r << 16) | (g << 8) | b;
        }
        return out;
    }

    private static int clampByte(float value) {
        return Math.max(0, Math.min(255, Math.round(value)));
    }

    private static final class Kernel {
        final int[] starts;
        final double[][] weights;

        private Kernel(int[] starts, double[][] weights) {
            this.starts = starts;
            this.weights = weights;
        }

        static Kernel build(int srcSize, int dstSize, ResampleFilter filter) {
            int[] starts = new int[dstSize];
            double[][] weights = new double[dstSize][];
            double ratio = (double) srcSize / dstSize;
            double scale = Math.max(1.0, ratio);
            double support = filter.support() * scale;

            for (int i = 0; i < dstSize; i++) {
                double center = (i + 0.5) * ratio;
                if (filter == ResampleFilter.NEAREST) {
                    starts[i] = Math.min((int) Math.floor(center), srcSize - 1);
                    weights[i] = new double[]{1.0};
                    continue;
                }
                int left = Math.max(0, (int) Math.floor(center - support));
                int right = Math.min(srcSize, (int) Math.ceil(center + support));
                if (right <= left) {
                    right = Math.min(srcSize, left + 1);
                    left = right - 1;
                }
                double[] w = new double[right - left];
                double sum = 0;
                for (int j = left; j < right; j++) {
                    double value = filter.weight((j - center + 0.5) / scale);
                    w[j - left] = value;
                    sum += value;
                }
                if (sum == 0) {
                    int nearest = Math.min((int) Math.floor(center), srcSize - 1);
                    starts[i] = nearest;
                    weights[i] = new double[]{1.0};
                    continue;
                }
                for (int j = 0; j < w.length; j++) {
                    w[j] /= sum;
                }
                starts[i] = left;
                weights[i] = w;
            }
            return new Kernel(starts, weights);
        }
    }
}
