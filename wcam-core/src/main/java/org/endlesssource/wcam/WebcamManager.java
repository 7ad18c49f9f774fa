package org.endlesssource.wcam;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamInfo;
import org.endlesssource.wcam.api.WebcamOptions;
import org.endlesssource.wcam.spi.CaptureException;
import org.endlesssource.wcam.spi.CaptureSession;
import org.endlesssource.wcam.spi.WebcamBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Keeps track of the plugged-in webcams and of every device a consumer asked for.
 * <p>
 * A dedicated thread enumerates devices and, for each requested device, opens the capture when needed,
 * marks it unplugged when the device disappears and reopens it after a failure or a resolution change.
 * Consumers get {@link SharedWebcam} handles from {@link #openOrGetWebcam(DeviceId)}; requests for the same
 * device share one capture session.
 */
public final class WebcamManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WebcamManager.class);

    private final WebcamBackend backend;
    private final ResolutionsManager resolutions;
    private final WebcamOptions options;
    private final ReentrantLock tickLock = new ReentrantLock();

    private final Object infosLock = new Object();
    private List<WebcamInfo> infos = List.of();

    private final Object registryLock = new Object();
    private final Map<DeviceId, Registration> requests = new HashMap<>();

    private final ScheduledExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebcamManager(WebcamBackend backend, ResolutionsManager resolutions, WebcamOptions options) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.resolutions = Objects.requireNonNull(resolutions, "resolutions must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        resolutions.bind(this);
        if (options.isBackgroundPollingEnabled()) {
            this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "wcam-manager");
                thread.setDaemon(true);
                return thread;
            });
            long intervalMs = options.getTickInterval().toMillis();
            executor.scheduleWithFixedDelay(this::update, 0, Math.max(1, intervalMs), TimeUnit.MILLISECONDS);
        } else {
            this.executor = null;
        }
        logger.info("Webcam manager started (backgroundPolling={}, tickInterval={})",
                options.isBackgroundPollingEnabled(), options.getTickInterval());
    }

    /**
     * Devices found by the latest enumeration. Never waits for the backend.
     */
    public List<WebcamInfo> infos() {
        synchronized (infosLock) {
            return infos;
        }
    }

    public boolean isPluggedIn(DeviceId id) {
        return findInfo(id).isPresent();
    }

    /**
     * Largest resolution the device supports, or {@link Resolution#DEGENERATE} if the device is unknown
     * or reports none.
     */
    public Resolution defaultResolution(DeviceId id) {
        return findInfo(id)
                .filter(info -> !info.resolutions().isEmpty())
                .map(info -> info.resolutions().get(0))
                .orElse(Resolution.DEGENERATE);
    }

    /**
     * Handle on the device, sharing the capture of any handle on it that is still open.
     * The capture is opened asynchronously by the polling thread.
     *
     * @throws IllegalStateException if the manager is closed
     */
    public SharedWebcam openOrGetWebcam(DeviceId id) {
        Objects.requireNonNull(id, "id must not be null");
        ensureOpen();
        synchronized (registryLock) {
            Registration registration = requests.get(id);
            WebcamRequest existing = registration == null ? null : registration.request();
            if (existing != null && existing.retain()) {
                return new SharedWebcam(existing);
            }
            WebcamRequest predecessor = existing != null ? existing
                    : registration == null ? null : registration.predecessor();
            if (predecessor != null && predecessor.isSettled()) {
                predecessor = null;
            }
            WebcamRequest request = new WebcamRequest(id, predecessor);
            requests.put(id, new Registration(new WeakReference<>(request), predecessor));
            logger.debug("Created capture request for {}", id);
            return new SharedWebcam(request);
        }
    }

    /**
     * Forces the capture of the device, if anyone holds it, to be reopened on the next tick.
     */
    public void requestRestart(DeviceId id) {
        Objects.requireNonNull(id, "id must not be null");
        findRequest(id).ifPresent(WebcamRequest::requestRestart);
    }

    public ResolutionsManager resolutions() {
        return resolutions;
    }

    public WebcamOptions options() {
        return options;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Runs one polling iteration: enumerate, then bring every requested device to the right state.
     * The background thread calls this; call it directly only when background polling is disabled.
     */
    public void update() {
        tickLock.lock();
        try {
            if (closed.get()) {
                return;
            }
            refreshInfos();
            for (WebcamRequest request : liveRequests()) {
                if (closed.get()) {
                    return;
                }
                updateRequest(request);
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // a throwable reaching the executor would cancel every later run
            logger.error("Webcam polling iteration failed", e);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Stops the polling thread, waits for it, and closes every capture session still open.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                long timeoutMs = options.getShutdownTimeout().toMillis();
                if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warn("Webcam polling thread did not stop within {} ms", timeoutMs);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        tickLock.lock();
        try {
            for (WebcamRequest request : liveRequests()) {
                request.transition(CaptureState.NOT_INITIALIZED);
            }
        } finally {
            tickLock.unlock();
        }
        resolutions.unbind(this);
        logger.info("Webcam manager closed");
    }

    private void refreshInfos() {
        List<WebcamInfo> fresh;
        try {
            fresh = backend.enumerate().stream()
                    .map(WebcamInfo::normalized)
                    .toList();
        } catch (RuntimeException e) {
            logger.warn("Failed to enumerate webcams, keeping previous list: {}", e.getMessage());
            return;
        }
        List<WebcamInfo> previous;
        synchronized (infosLock) {
            previous = infos;
            infos = fresh;
        }
        if (logger.isDebugEnabled()) {
            logPlugEvents(previous, fresh);
        }
    }

    private void updateRequest(WebcamRequest request) {
        DeviceId id = request.id();
        if (!isPluggedIn(id)) {
            if (!(request.state() instanceof CaptureState.Failed failed && failed.error() instanceof CaptureError.Unplugged)) {
                logger.debug("Webcam {} is unplugged", id);
            }
            request.transition(new CaptureState.Failed(CaptureError.UNPLUGGED));
            return;
        }

        WebcamRequest.Observation observation = request.observe();
        if (observation.state() instanceof CaptureState.Active active) {
            Optional<CaptureError> failure = active.session().failure();
            if (failure.isPresent()) {
                logger.warn("Capture of {} stopped: {}", id, failure.get().message());
                request.replace(active, new CaptureState.Failed(failure.get()));
            }
            return;
        }

        if (request.isWaitingForPredecessor()) {
            logger.debug("Delaying open of {} until the previous capture is closed", id);
            return;
        }
        Resolution resolution = resolutions.selectedResolution(id);
        try {
            CaptureSession session = backend.open(id, resolution);
            if (closed.get()) {
                session.close();
                return;
            }
            if (request.activate(session, resolution, observation.generation())) {
                logger.debug("Opened {} at {}", id, resolution);
            } else {
                logger.debug("Discarded capture of {} opened at {}: request changed meanwhile", id, resolution);
            }
        } catch (CaptureException e) {
            logger.debug("Failed to open {} at {}: {}", id, resolution, e.getMessage());
            request.fail(e.error(), observation.generation());
        } catch (RuntimeException | LinkageError e) {
            logger.warn("Backend failed while opening {} at {}", id, resolution, e);
            request.fail(CaptureError.other(describe(e)), observation.generation());
        }
    }

    private List<WebcamRequest> liveRequests() {
        List<WebcamRequest> live = new ArrayList<>();
        synchronized (registryLock) {
            Iterator<Registration> it = requests.values().iterator();
            while (it.hasNext()) {
                Registration registration = it.next();
                WebcamRequest request = registration.request();
                // released requests stay registered until their session is closed,
                // so the next request for the device waits for them
                boolean settled = request == null
                        ? registration.predecessor() == null || registration.predecessor().isSettled()
                        : request.isSettled();
                if (settled) {
                    it.remove();
                } else if (request != null && !request.isReleased()) {
                    live.add(request);
                }
            }
        }
        return live;
    }

    private Optional<WebcamRequest> findRequest(DeviceId id) {
        synchronized (registryLock) {
            Registration registration = requests.get(id);
            WebcamRequest request = registration == null ? null : registration.request();
            if (request == null || request.isReleased()) {
                return Optional.empty();
            }
            return Optional.of(request);
        }
    }

    private Optional<WebcamInfo> findInfo(DeviceId id) {
        Objects.requireNonNull(id, "id must not be null");
        synchronized (infosLock) {
            return infos.stream()
                    .filter(info -> info.id().equals(id))
                    .findFirst();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Webcam manager is closed");
        }
    }

    private static void logPlugEvents(List<WebcamInfo> previous, List<WebcamInfo> current) {
        Set<DeviceId> before = previous.stream().map(WebcamInfo::id).collect(Collectors.toSet());
        Set<DeviceId> after = current.stream().map(WebcamInfo::id).collect(Collectors.toSet());
        Set<DeviceId> added = new HashSet<>(after);
        added.removeAll(before);
        Set<DeviceId> removed = new HashSet<>(before);
        removed.removeAll(after);
        added.forEach(id -> logger.debug("Webcam plugged in: {}", id));
        removed.forEach(id -> logger.debug("Webcam removed: {}", id));
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    /**
     * Registry entry. The request itself is only weakly held; {@code predecessor} is the earlier
     * request it waits for, kept strongly until that one has closed its session.
     */
    private record Registration(WeakReference<WebcamRequest> reference, WebcamRequest predecessor) {
        WebcamRequest request() {
            return reference.get();
        }
    }
}
