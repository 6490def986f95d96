package com.glimpse.core.io;

import org.apache.batik.transcoder.TranscoderException;
import org.apache.batik.transcoder.TranscoderInput;
import org.apache.batik.transcoder.TranscoderOutput;
import org.apache.batik.transcoder.image.PNGTranscoder;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rasterizes SVG documents at their intrinsic size with Batik.
 */
final class SvgRasterizer {

    private SvgRasterizer() {
    }

    static BufferedImage rasterize(Path svg) throws IOException {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        try (InputStream in = Files.newInputStream(svg)) {
            PNGTranscoder transcoder = new PNGTranscoder();
            transcoder.addTranscodingHint(PNGTranscoder.KEY_BACKGROUND_COLOR, new Color(0, 0, 0, 0));
            transcoder.addTranscodingHint(PNGTranscoder.KEY_ALLOW_EXTERNAL_RESOURCES, true);
            TranscoderInput input = new TranscoderInput(in);
            input.setURI(svg.toUri().toString());
            transcoder.transcode(input, new TranscoderOutput(png));
        } catch (TranscoderException ex) {
            throw new DecodeException(svg, "Invalid SVG " + svg.getFileName() + ": " + ex.getMessage(), ex);
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png.toByteArray()));
        if (image == null) {
            throw new DecodeException(svg, "SVG produced no image: " + svg.getFileName());
        }
        return image;
    }
}
