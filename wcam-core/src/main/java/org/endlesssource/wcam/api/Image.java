package org.endlesssource.wcam.api;

import java.time.Instant;
import java.util.Objects;

/**
 * One decoded frame, handed out by a capture session at most once.
 *
 * @param resolution  frame size
 * @param pixelFormat layout of {@code pixels}
 * @param pixels      raw pixel buffer, owned by the receiver
 * @param capturedAt  time the backend received the frame
 */
public record Image(Resolution resolution, PixelFormat pixelFormat, byte[] pixels, Instant capturedAt)
        implements MaybeImage {
    public Image {
        Objects.requireNonNull(resolution, "resolution must not be null");
        Objects.requireNonNull(pixelFormat, "pixelFormat must not be null");
        Objects.requireNonNull(pixels, "pixels must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (pixels.length < pixelFormat.frameSize(resolution)) {
            throw new IllegalArgumentException("pixel buffer too small for " + resolution + " " + pixelFormat
                    + ": " + pixels.length + " bytes");
        }
    }
}
