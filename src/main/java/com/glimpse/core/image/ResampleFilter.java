package com.glimpse.core.image;

/**
 * Reconstruction kernels available to {@link Resampler}.
 */
public enum ResampleFilter {
    NEAREST("Nearest Neighbor", 0.0) {
        @Override
        double weight(double x) {
            return (x >= -0.5 && x < 0.5) ? 1.0 : 0.0;
        }
    },
    TRIANGLE("Linear Filter", 1.0) {
        @Override
        double weight(double x) {
            double a = Math.abs(x);
            return a < 1.0 ? 1.0 - a : 0.0;
        }
    },
    CATMULL_ROM("Cubic Filter", 2.0) {
        @Override
        double weight(double x) {
            double a = Math.abs(x);
            if (a < 1.0) {
                return 1.5 * a * a * a - 2.5 * a * a + 1.0;
            }
            if (a < 2.0) {
                return -0.5 * a * a * a + 2.5 * a * a - 4.0 * a + 2.0;
            }
            return 0.0;
        }
    },
    GAUSSIAN("Gaussian Filter", 3.0) {
        @Override
        double weight(double x) {
            // sigma 0.5
            return Math.exp(-2.0 * x * x) * Math.sqrt(2.0 / Math.PI);
        }
    },
    LANCZOS3("Lanczos", 3.0) {
        @Override
        double weight(double x) {
            double a = Math.abs(x);
            if (a >= 3.0) {
                return 0.0;
            }
            return sinc(a) * sinc(a / 3.0);
        }
    };

    private final String displayName;
    private final double support;

    ResampleFilter(String displayName, double support) {
        this.displayName = displayName;
        this.support = support;
    }

    public String displayName() {
        return displayName;
    }

    double support() {
        return support;
    }

    abstract double weight(double x);

    public static ResampleFilter fromName(String name, ResampleFilter fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        for (ResampleFilter filter : values()) {
            if (filter.name().equalsIgnoreCase(name.trim()) || filter.displayName.equalsIgnoreCase(name.trim())) {
                return filter;
            }
        }
        return fallback;
    }

    @Override
    public String toString() {
        return displayName;
    }

    private static double sinc(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }
}
