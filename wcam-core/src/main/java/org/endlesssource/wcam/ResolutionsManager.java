package org.endlesssource.wcam;

import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the resolution the user picked for each device.
 * <p>
 * Choices outlive capture sessions, unplugs and managers: a manager binds to this store while it runs
 * and unbinds when closed, while the table stays. {@link WebcamLibrary#resolutions()} is the process-wide instance.
 */
public final class ResolutionsManager {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionsManager.class);

    private final Object lock = new Object();
    private final Map<DeviceId, Resolution> selected = new HashMap<>();
    private final AtomicReference<WebcamManager> manager = new AtomicReference<>();

    /**
     * Resolution the device should be opened at: the stored choice, else the device's largest resolution,
     * else {@link Resolution#DEGENERATE} when no manager is running.
     */
    public Resolution selectedResolution(DeviceId id) {
        Objects.requireNonNull(id, "id must not be null");
        Resolution stored;
        synchronized (lock) {
            stored = selected.get(id);
        }
        return stored != null ? stored : defaultResolution(id);
    }

    /**
     * Explicitly stored choice for the device, if any.
     */
    public Optional<Resolution> storedResolution(DeviceId id) {
        Objects.requireNonNull(id, "id must not be null");
        synchronized (lock) {
            return Optional.ofNullable(selected.get(id));
        }
    }

    /**
     * Stores the choice and, when it differs from the resolution in effect, asks the running manager
     * to reopen the device with it.
     */
    public void setSelectedResolution(DeviceId id, Resolution resolution) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(resolution, "resolution must not be null");
        Resolution previous;
        synchronized (lock) {
            previous = selected.put(id, resolution);
        }
        Resolution effective = previous != null ? previous : defaultResolution(id);
        if (resolution.equals(effective)) {
            return;
        }
        logger.debug("Selected resolution for {} changed from {} to {}", id, effective, resolution);
        WebcamManager current = manager.get();
        if (current != null) {
            current.requestRestart(id);
        }
    }

    void bind(WebcamManager webcamManager) {
        if (!manager.compareAndSet(null, webcamManager)) {
            throw new IllegalStateException("Another webcam manager is already running");
        }
    }

    void unbind(WebcamManager webcamManager) {
        manager.compareAndSet(webcamManager, null);
    }

    private Resolution defaultResolution(DeviceId id) {
        WebcamManager current = manager.get();
        return current == null ? Resolution.DEGENERATE : current.defaultResolution(id);
    }
}
