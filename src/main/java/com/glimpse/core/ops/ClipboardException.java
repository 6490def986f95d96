package com.glimpse.core.ops;

import java.io.IOException;

public class ClipboardException extends IOException {

    public ClipboardException(String message) {
        super(message);
    }

    public ClipboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
