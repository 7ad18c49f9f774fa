package org.endlesssource.wcam.api;

import java.util.Objects;

/**
 * Reason a device cannot currently be captured.
 */
public sealed interface CaptureError extends MaybeImage
        permits CaptureError.Unplugged, CaptureError.AlreadyInUse, CaptureError.Other {

    Unplugged UNPLUGGED = new Unplugged();
    AlreadyInUse ALREADY_IN_USE = new AlreadyInUse();

    /**
     * Diagnostic text, not meant to be parsed.
     */
    String message();

    static Other other(String message) {
        return new Other(message);
    }

    /**
     * The device is absent from the latest enumeration.
     */
    record Unplugged() implements CaptureError {
        @Override
        public String message() {
            return "Webcam is unplugged";
        }
    }

    /**
     * Another application holds exclusive access to the device.
     */
    record AlreadyInUse() implements CaptureError {
        @Override
        public String message() {
            return "Webcam is already used in another application";
        }
    }

    record Other(String message) implements CaptureError {
        public Other {
            message = Objects.requireNonNullElse(message, "Unknown capture error");
        }
    }
}
