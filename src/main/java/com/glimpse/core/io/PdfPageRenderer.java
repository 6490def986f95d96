package com.glimpse.core.io;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders the first page of a PDF so documents can be browsed alongside images.
 */
final class PdfPageRenderer {

    private PdfPageRenderer() {
    }

    static BufferedImage renderFirstPage(Path pdf, int dpi) throws IOException {
        try (PDDocument doc = PDDocument.load(pdf.toFile())) {
            if (doc.getNumberOfPages() == 0) {
                throw new DecodeException(pdf, pdf.getFileName() + " has no pages");
            }
            PDFRenderer renderer = new PDFRenderer(doc);
            renderer.setSubsamplingAllowed(true);
            return renderer.renderImageWithDPI(0, dpi, ImageType.ARGB);
        } catch (DecodeException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new DecodeException(pdf, "Cannot read PDF " + pdf.getFileName() + ": " + ex.getMessage(), ex);
        }
    }
}
