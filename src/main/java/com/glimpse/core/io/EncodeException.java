package com.glimpse.core.io;

import java.io.IOException;

/**
 * Raised when frames cannot be written in the requested format.
 */
public class EncodeException extends IOException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
