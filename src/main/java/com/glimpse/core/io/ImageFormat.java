package com.glimpse.core.io;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File formats known to {@link StandardImageCodec}, resolved from the file extension.
 */
public enum ImageFormat {
    PNG("png", true, List.of("png")),
    JPEG("jpeg", true, List.of("jpg", "jpeg", "jpe", "jfif")),
    BMP("bmp", true, List.of("bmp")),
    GIF("gif", true, List.of("gif")),
    TIFF("tiff", true, List.of("tif", "tiff")),
    WBMP("wbmp", true, List.of("wbmp")),
    SVG("svg", false, List.of("svg")),
    PDF("pdf", false, List.of("pdf"));

    private final String imageIoName;
    private final boolean encodable;
    private final List<String> extensions;

    ImageFormat(String imageIoName, boolean encodable, List<String> extensions) {
        this.imageIoName = imageIoName;
        this.encodable = encodable;
        this.extensions = extensions;
    }

    public String imageIoName() {
        return imageIoName;
    }

    public boolean canEncode() {
        return encodable;
    }

    public boolean supportsAnimation() {
        return this == GIF;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Optional<ImageFormat> fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(name.substring(dot + 1));
    }

    public static Optional<ImageFormat> fromExtension(String extension) {
        String lower = extension.toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.extensions.contains(lower)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static boolean isDecodable(Path path) {
        return fromPath(path).isPresent();
    }

    public static Set<String> encodableExtensions() {
        Set<String> out = new LinkedHashSet<>();
        for (ImageFormat format : values()) {
            if (format.encodable) {
                out.addAll(format.extensions);
            }
        }
        return out;
    }
}
