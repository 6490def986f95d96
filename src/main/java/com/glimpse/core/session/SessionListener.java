package com.glimpse.core.session;

import com.glimpse.core.document.ImageDocument;

/**
 * Notified on the UI thread after an output has been applied.
 */
@FunctionalInterface
public interface SessionListener {

    /**
     * @param document the open document, {@code null} after a close
     */
    void documentChanged(ImageDocument document);
}
