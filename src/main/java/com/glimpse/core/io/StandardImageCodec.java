package com.glimpse.core.io;

import com.glimpse.core.image.Frame;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Default codec: raster formats through {@link ImageIO}, animated GIF through {@link GifCodec},
 * SVG through Batik and PDF through PDFBox. Writes always go through {@link AtomicFileWriter}.
 */
public final class StandardImageCodec implements ImageCodec {

    private static final Logger LOGGER = Logger.getLogger(StandardImageCodec.class.getName());
    private static final int DEFAULT_PDF_DPI = 150;

    private final int pdfDpi;

    public StandardImageCodec() {
        this(DEFAULT_PDF_DPI);
    }

    public StandardImageCodec(int pdfDpi) {
        this.pdfDpi = pdfDpi > 0 ? pdfDpi : DEFAULT_PDF_DPI;
    }

    @Override
    public List<Frame> decode(Path path) throws IOException {
        ImageFormat format = ImageFormat.fromPath(path)
            .orElseThrow(() -> new DecodeException(path, "Unsupported file type: " + path.getFileName()));
        if (!Files.isRegularFile(path)) {
            throw new DecodeException(path, "File not found: " + path);
        }
        long started = System.nanoTime();
        List<Frame> frames = switch (format) {
            case GIF -> GifCodec.decode(path);
            case SVG -> List.of(Frame.still(SvgRasterizer.rasterize(path)));
            case PDF -> List.of(Frame.still(PdfPageRenderer.renderFirstPage(path, pdfDpi)));
            default -> List.of(Frame.still(readRaster(path)));
        };
        if (frames.isEmpty()) {
            throw new DecodeException(path, path.getFileName() + " contains no images");
        }
        LOGGER.fine(() -> String.format("Decoded %s (%d frame(s)) in %d ms",
            path.getFileName(), frames.size(), (System.nanoTime() - started) / 1_000_000));
        return frames;
    }

    @Override
    public void encode(Path path, ImageFormat format, List<Frame> frames) throws IOException {
        if (!format.canEncode()) {
            throw new EncodeException("Saving as " + format.name() + " is not supported");
        }
        if (frames == null || frames.isEmpty()) {
            throw new EncodeException("Nothing to save");
        }
        if (format.supportsAnimation()) {
            AtomicFileWriter.write(path, out -> GifCodec.encode(out, frames));
            return;
        }
        if (frames.size() > 1) {
            LOGGER.info(() -> format.name() + " cannot hold animations; saving the first of "
                + frames.size() + " frames to " + path.getFileName());
        }
        BufferedImage image = prepareForFormat(frames.get(0).image(), format);
        AtomicFileWriter.write(path, out -> {
            if (!ImageIO.write(image, format.imageIoName(), out)) {
                throw new EncodeException("No " + format.imageIoName() + " writer accepts this image");
            }
        });
    }

    private static BufferedImage readRaster(Path path) throws IOException {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException ex) {
            throw new DecodeException(path, "Cannot decode " + path.getFileName() + ": " + ex.getMessage(), ex);
        }
        if (image == null) {
            throw new DecodeException(path, "Unrecognized image data in " + path.getFileName());
        }
        return image;
    }

    private static BufferedImage prepareForFormat(BufferedImage source, ImageFormat format) {
        return switch (format) {
            case JPEG, BMP -> flatten(source, BufferedImage.TYPE_INT_RGB);
            case WBMP -> flatten(source, BufferedImage.TYPE_BYTE_BINARY);
            default -> source;
        };
    }

    private static BufferedImage flatten(BufferedImage source, int type) {
        if (source.getType() == type) {
            return source;
        }
        BufferedImage out = new BufferedImage(source.getWidth(), source.getHeight(), type);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, out.getWidth(), out.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
