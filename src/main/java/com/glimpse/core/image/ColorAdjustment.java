package com.glimpse.core.image;

/**
 * Hue shift in degrees ({@code -180..180}); contrast, saturation and lightness in percent
 * ({@code -100..100}). All zero is the neutral adjustment.
 */
public record ColorAdjustment(float hue, float contrast, float saturation, float lightness) {

    public static final ColorAdjustment NEUTRAL = new ColorAdjustment(0f, 0f, 0f, 0f);

    public ColorAdjustment {
        hue = clamp(hue, -180f, 180f);
        contrast = clamp(contrast, -100f, 100f);
        saturation = clamp(saturation, -100f, 100f);
        lightness = clamp(lightness, -100f, 100f);
    }

    public boolean isNeutral() {
        return hue == 0f && contrast == 0f && saturation == 0f && lightness == 0f;
    }

    private static float clamp(float value, float min, float max) {
        if (Float.isNaN(value)) {
            return 0f;
        }
        return Math.max(min, Math.min(max, value));
    }
}
