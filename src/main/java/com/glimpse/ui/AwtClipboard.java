package com.glimpse.ui;

import com.glimpse.core.ops.ClipboardAccess;
import com.glimpse.core.ops.ClipboardException;

import java.awt.Graphics2D;
import java.awt.HeadlessException;
import java.awt.Image;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.Transferable;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * {@link ClipboardAccess} backed by the AWT system clipboard.
 */
final class AwtClipboard implements ClipboardAccess {

    @Override
    public void writeImage(BufferedImage image) throws IOException {
        try {
            systemClipboard().setContents(new ImageSelection(image), null);
        } catch (IllegalStateException ex) {
            throw new ClipboardException("Clipboard is busy, try again", ex);
        }
    }

    @Override
    public BufferedImage readImage() throws IOException {
        Transferable contents;
        try {
            contents = systemClipboard().getContents(null);
        } catch (IllegalStateException ex) {
            throw new ClipboardException("Clipboard is busy, try again", ex);
        }
        if (contents == null || !contents.isDataFlavorSupported(DataFlavor.imageFlavor)) {
            throw new ClipboardException("Clipboard does not contain an image");
        }
        try {
            return toBuffered((Image) contents.getTransferData(DataFlavor.imageFlavor));
        } catch (UnsupportedFlavorException ex) {
            throw new ClipboardException("Clipboard does not contain an image", ex);
        }
    }

    private static Clipboard systemClipboard() throws ClipboardException {
        try {
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        } catch (HeadlessException ex) {
            throw new ClipboardException("No system clipboard available", ex);
        }
    }

    private static BufferedImage toBuffered(Image image) throws ClipboardException {
        if (image instanceof BufferedImage buffered) {
            return buffered;
        }
        int width = image.getWidth(null);
        int height = image.getHeight(null);
        if (width <= 0 || height <= 0) {
            throw new ClipboardException("Clipboard image is empty");
        }
        BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    private record ImageSelection(BufferedImage image) implements Transferable {

        @Override
        public DataFlavor[] getTransferDataFlavors() {
            return new DataFlavor[]{DataFlavor.imageFlavor};
        }

        @Override
        public boolean isDataFlavorSupported(DataFlavor flavor) {
            return DataFlavor.imageFlavor.equals(flavor);
        }

        @Override
        public Object getTransferData(DataFlavor flavor) throws UnsupportedFlavorException {
            if (!isDataFlavorSupported(flavor)) {
                throw new UnsupportedFlavorException(flavor);
            }
            return image;
        }
    }
}
