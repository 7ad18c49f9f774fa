package org.endlesssource.wcam.spi;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.Resolution;

import java.util.Optional;

/**
 * An open, streaming connection to one physical device at one resolution.
 */
public interface CaptureSession extends AutoCloseable {

    /**
     * Latest frame if it was not handed out yet, otherwise {@link MaybeImage#NO_NEW_IMAGE_YET}.
     * Never blocks waiting for the device.
     */
    MaybeImage image();

    /**
     * Resolution negotiated with the device.
     */
    Resolution resolution();

    /**
     * Error observed while streaming, if the session broke after it was opened.
     */
    Optional<CaptureError> failure();

    /**
     * Release the device synchronously. Must not block indefinitely.
     */
    @Override
    void close();
}
