package org.endlesssource.wcam;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.spi.CaptureSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-device cell holding the capture state shared by every {@link SharedWebcam} on that device.
 * The manager keeps only a weak reference to it; handles keep it alive and release it when the last one closes.
 */
final class WebcamRequest {
    private static final Logger logger = LoggerFactory.getLogger(WebcamRequest.class);

    private final DeviceId id;
    private final Object lock = new Object();
    private final AtomicInteger handles = new AtomicInteger(1);
    private volatile WebcamRequest predecessor;
    private volatile boolean disposed;

    // guarded by lock
    private CaptureState state = CaptureState.NOT_INITIALIZED;
    private long generation;
    private boolean released;

    WebcamRequest(DeviceId id) {
        this(id, null);
    }

    /**
     * @param predecessor released request for the same device whose session may still be closing
     */
    WebcamRequest(DeviceId id, WebcamRequest predecessor) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.predecessor = predecessor;
    }

    DeviceId id() {
        return id;
    }

    CaptureState state() {
        synchronized (lock) {
            return state;
        }
    }

    Observation observe() {
        synchronized (lock) {
            return new Observation(state, generation);
        }
    }

    boolean isReleased() {
        return handles.get() == 0;
    }

    /**
     * True once the last handle was released, the session it held is closed and no earlier
     * request for the device is still closing. A settled request no longer constrains the device.
     */
    boolean isSettled() {
        return disposed && !isWaitingForPredecessor();
    }

    /**
     * True while an earlier request for this device, or one it was itself waiting for,
     * has not closed its session yet. The device must not be opened again before that.
     */
    boolean isWaitingForPredecessor() {
        WebcamRequest previous = predecessor;
        if (previous == null) {
            return false;
        }
        if (previous.isSettled()) {
            predecessor = null;
            return false;
        }
        return true;
    }

    MaybeImage image() {
        synchronized (lock) {
            if (state instanceof CaptureState.Active active) {
                return active.session().image();
            }
            if (state instanceof CaptureState.Failed failed) {
                return failed.error();
            }
            return MaybeImage.NOT_INITIALIZED_YET;
        }
    }

    /**
     * Adds a handle. Fails once the last handle was released, so a dying request is never revived.
     */
    boolean retain() {
        while (true) {
            int current = handles.get();
            if (current == 0) {
                return false;
            }
            if (handles.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void release() {
        int remaining = handles.decrementAndGet();
        if (remaining > 0) {
            return;
        }
        CaptureState last;
        synchronized (lock) {
            released = true;
            last = state;
            state = CaptureState.NOT_INITIALIZED;
        }
        logger.debug("Released capture request for {}", id);
        dispose(last);
        disposed = true;
    }

    /**
     * Unconditionally replaces the state. Used for unplug detection and shutdown.
     */
    void transition(CaptureState next) {
        CaptureState replaced;
        synchronized (lock) {
            if (released) {
                replaced = next;
            } else {
                replaced = state == next ? null : state;
                state = next;
            }
        }
        dispose(replaced);
    }

    /**
     * Replaces the state only if it is still {@code expected}.
     */
    boolean replace(CaptureState expected, CaptureState next) {
        synchronized (lock) {
            if (released || state != expected) {
                return false;
            }
            state = next;
        }
        dispose(expected);
        return true;
    }

    /**
     * Installs a freshly opened session unless the request was restarted or released since {@code expectedGeneration}.
     * A rejected session is closed.
     */
    boolean activate(CaptureSession session, Resolution resolution, long expectedGeneration) {
        CaptureState replaced;
        synchronized (lock) {
            if (released || generation != expectedGeneration) {
                replaced = null;
            } else {
                replaced = state;
                state = new CaptureState.Active(session, resolution);
            }
        }
        if (replaced == null) {
            closeQuietly(session);
            return false;
        }
        dispose(replaced);
        return true;
    }

    /**
     * Records an open failure unless the request was restarted or released meanwhile.
     */
    boolean fail(CaptureError error, long expectedGeneration) {
        CaptureState replaced;
        synchronized (lock) {
            if (released || generation != expectedGeneration) {
                return false;
            }
            replaced = state;
            state = new CaptureState.Failed(error);
        }
        dispose(replaced);
        return true;
    }

    void requestRestart() {
        CaptureState replaced;
        synchronized (lock) {
            if (released) {
                return;
            }
            generation++;
            replaced = state;
            state = CaptureState.NOT_INITIALIZED;
        }
        logger.debug("Restart requested for {}", id);
        dispose(replaced);
    }

    private void dispose(CaptureState state) {
        if (state instanceof CaptureState.Active active) {
            closeQuietly(active.session());
        }
    }

    private void closeQuietly(CaptureSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close capture session for {}: {}", id, e.getMessage());
        }
    }

    record Observation(CaptureState state, long generation) {
    }
}
