package com.glimpse.core.ops;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * System clipboard boundary used by {@link Op.Copy} and {@link Op.Paste}.
 */
public interface ClipboardAccess {

    void writeImage(BufferedImage image) throws IOException;

    /**
     * @throws ClipboardException when the clipboard holds no image
     */
    BufferedImage readImage() throws IOException;
}
