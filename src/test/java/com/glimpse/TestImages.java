package com.glimpse;

import com.glimpse.core.image.Frame;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Small synthetic images whose pixels differ by position. */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage pattern(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, pixel(x, y));
            }
        }
        return image;
    }

    public static int pixel(int x, int y) {
        return 0xFF000000 | ((x * 37) & 0xFF) << 16 | ((y * 53) & 0xFF) << 8 | ((x * 11 + y * 7) & 0xFF);
    }

    public static BufferedImage solid(int width, int height, int argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    public static List<Frame> still(BufferedImage image) {
        return List.of(Frame.still(image));
    }

    public static Path writePng(Path path, int width, int height) throws IOException {
        ImageIO.write(pattern(width, height), "png", path.toFile());
        return path;
    }
}
