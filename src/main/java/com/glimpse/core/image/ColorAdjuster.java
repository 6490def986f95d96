package com.glimpse.core.image;

import java.awt.image.BufferedImage;

/**
 * Contrast is applied in RGB first; hue, saturation and lightness are then adjusted in HSL.
 */
final class ColorAdjuster {

    private ColorAdjuster() {
    }

    static BufferedImage apply(BufferedImage source, ColorAdjustment adjustment) {
        int w = source.getWidth();
        int h = source.getHeight();
        int[] pixels = source.getRGB(0, 0, w, h, null, 0, w);
        if (!adjustment.isNeutral()) {
            double contrast = (100.0 + adjustment.contrast()) / 100.0;
            contrast *= contrast;
            double hueShift = adjustment.hue() / 360.0;
            double saturation = 1.0 + adjustment.saturation() / 100.0;
            double lightness = adjustment.lightness() / 100.0;
            double[] hsl = new double[3];
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] = adjustPixel(pixels[i], contrast, hueShift, saturation, lightness, hsl);
            }
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, pixels, 0, w);
        return out;
    }

    private static int adjustPixel(int argb, double contrast, double hueShift, double saturation,
                                   double lightness, double[] hsl) {
        int alpha = argb >>> 24;
        double r = applyContrast(((argb >> 16) & 0xFF) / 255.0, contrast);
        double g = applyContrast(((argb >> 8) & 0xFF) / 255.0, contrast);
        double b = applyContrast((argb & 0xFF) / 255.0, contrast);

        toHsl(r, g, b, hsl);
        double hue = hsl[0] + hueShift;
        hue -= Math.floor(hue);
        double sat = clamp01(hsl[1] * saturation);
        double light = hsl[2];
        light = lightness >= 0 ? light + (1.0 - light) * lightness : light * (1.0 + lightness);

        return (alpha << 24) | fromHsl(hue, sat, clamp01(light));
    }

    private static double applyContrast(double value, double factor) {
        return clamp01((value - 0.5) * factor + 0.5);
    }

    private static void toHsl(double r, double g, double b, double[] out) {
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double l = (max + min) / 2.0;
        double h = 0;
        double s = 0;
        double d = max - min;
        if (d > 0) {
            s = l > 0.5 ? d / (2.0 - max - min) : d / (max + min);
            if (max == r) {
                h = (g - b) / d + (g < b ? 6 : 0);
            } else if (max == g) {
                h = (b - r) / d + 2;
            } else {
                h = (r - g) / d + 4;
            }
            h /= 6.0;
        }
        out[0] = h;
        out[1] = s;
        out[2] = l;
    }

    private static int fromHsl(double h, double s, double l) {
        double r;
        double g;
        double b;
        if (s == 0) {
            r = g = b = l;
        } else {
            double q = l < 0.5 ? l * (1 + s) : l + s - l * s;
            double p = 2 * l - q;
            r = hueToChannel(p, q, h + 1.0 / 3);
            g = hueToChannel(p, q, h);
            b = hueToChannel(p, q, h - 1.0 / 3);
        }
        return (toByte(r) << 16) | (toByte(g) << 8) | toByte(b);
    }

    private static double hueToChannel(double p, double q, double t) {
        if (t < 0) t += 1;
        if (t > 1) t -= 1;
        if (t < 1.0 / 6) return p + (q - p) * 6 * t;
        if (t < 1.0 / 2) return q;
        if (t < 2.0 / 3) return p + (q - p) * (2.0 / 3 - t) * 6;
        return p;
    }

    private static int toByte(double value) {
        return (int) Math.round(clamp01(value) * 255.0);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
