package org.endlesssource.wcam;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.spi.CaptureSession;

import java.util.Objects;

/**
 * Capture state of one requested device.
 * Exactly one variant holds at a time; the manager's polling thread moves a request between them.
 */
public sealed interface CaptureState
        permits CaptureState.NotInitialized, CaptureState.Active, CaptureState.Failed {

    NotInitialized NOT_INITIALIZED = new NotInitialized();

    /**
     * Nothing opened yet, or a restart was requested. The next tick opens the device.
     */
    record NotInitialized() implements CaptureState {
    }

    /**
     * A session is open and streaming.
     */
    record Active(CaptureSession session, Resolution resolution) implements CaptureState {
        public Active {
            Objects.requireNonNull(session, "session must not be null");
            Objects.requireNonNull(resolution, "resolution must not be null");
        }
    }

    /**
     * The device could not be captured. The next tick retries unless the device is unplugged.
     */
    record Failed(CaptureError error) implements CaptureState {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
