package org.endlesssource.wcam;

import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.MaybeImage;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumer handle on a webcam. Every handle obtained for the same device shares one capture session.
 * <p>
 * Close the handle when done with it. The device is released once the last handle on it is closed;
 * a handle that becomes unreachable without being closed is released by the garbage collector.
 */
public final class SharedWebcam implements AutoCloseable {
    private static final Cleaner CLEANER = Cleaner.create();

    private final WebcamRequest request;
    private final Cleaner.Cleanable cleanable;
    private final AtomicBoolean closed = new AtomicBoolean();

    SharedWebcam(WebcamRequest request) {
        this.request = request;
        this.cleanable = CLEANER.register(this, new Release(request));
    }

    public DeviceId id() {
        return request.id();
    }

    /**
     * Latest frame not yet handed out, or a marker describing why there is none.
     * Never blocks waiting for the device.
     *
     * @throws IllegalStateException if this handle was closed
     */
    public MaybeImage image() {
        ensureOpen();
        return request.image();
    }

    /**
     * Current capture state of the device.
     *
     * @throws IllegalStateException if this handle was closed
     */
    public CaptureState state() {
        ensureOpen();
        return request.state();
    }

    /**
     * Another handle on the same device, closed independently of this one.
     *
     * @throws IllegalStateException if this handle was closed
     */
    public SharedWebcam share() {
        ensureOpen();
        if (!request.retain()) {
            throw new IllegalStateException("Webcam " + request.id() + " was already released");
        }
        return new SharedWebcam(request);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cleanable.clean();
        }
    }

    WebcamRequest request() {
        return request;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Webcam handle for " + request.id() + " is closed");
        }
    }

    private static final class Release implements Runnable {
        private final WebcamRequest request;

        private Release(WebcamRequest request) {
            this.request = request;
        }

        @Override
        public void run() {
            request.release();
        }
    }
}
