package org.endlesssource.wcam.spi;

import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamInfo;

import java.util.List;

/**
 * Platform capture backend driven by the manager's polling thread.
 * Both operations may block on device I/O; the manager never calls them while holding a lock.
 */
public interface WebcamBackend {

    /**
     * List the devices currently available.
     * Must return a consistent list for the whole call and an empty list rather than failing
     * when no device is present.
     *
     * @return devices with their supported resolutions, in any order
     */
    List<WebcamInfo> enumerate();

    /**
     * Open a capture session on a device.
     *
     * @param id         device to open
     * @param resolution requested frame size; the backend may negotiate a different one
     * @return an open session, owned by the caller
     * @throws CaptureException if the device cannot be opened, with the classified reason
     */
    CaptureSession open(DeviceId id, Resolution resolution) throws CaptureException;
}
