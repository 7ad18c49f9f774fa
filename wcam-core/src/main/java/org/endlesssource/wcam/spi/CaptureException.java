package org.endlesssource.wcam.spi;

import org.endlesssource.wcam.api.CaptureError;

import java.util.Objects;

/**
 * Thrown by a backend when a capture session cannot be opened.
 */
public class CaptureException extends Exception {
    private final CaptureError error;

    public CaptureException(CaptureError error) {
        this(error, null);
    }

    public CaptureException(CaptureError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error must not be null").message(), cause);
        this.error = error;
    }

    public CaptureError error() {
        return error;
    }
}
