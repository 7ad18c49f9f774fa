package org.endlesssource.wcam;

import org.endlesssource.wcam.api.WebcamOptions;
import org.endlesssource.wcam.spi.WebcamBackend;
import org.endlesssource.wcam.spi.WebcamBackendProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Entry point of the library: picks the capture backend for the current platform and keeps one
 * {@link WebcamManager} running for as long as at least one {@link LibraryHandle} is open.
 */
public final class WebcamLibrary {
    private static final Logger logger = LoggerFactory.getLogger(WebcamLibrary.class);

    private static final Object LIFECYCLE_LOCK = new Object();
    private static ResolutionsManager resolutions;
    private static WebcamManager manager;
    private static int openHandles;

    private WebcamLibrary() {}

    /**
     * Process-wide store of selected resolutions. Created on first use and never torn down,
     * so choices survive the manager being stopped and started again.
     */
    public static ResolutionsManager resolutions() {
        synchronized (LIFECYCLE_LOCK) {
            if (resolutions == null) {
                resolutions = new ResolutionsManager();
            }
            return resolutions;
        }
    }

    /**
     * Keep the library running with default options.
     * @see #keepAlive(WebcamOptions)
     */
    public static LibraryHandle keepAlive() {
        return keepAlive(WebcamOptions.defaults());
    }

    /**
     * Keep the library running. The first open handle starts the manager with the given options;
     * later handles reuse the running manager and ignore their options. Closing the last handle stops it.
     *
     * @throws UnsupportedOperationException if no backend is available for the current platform
     */
    public static LibraryHandle keepAlive(WebcamOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        synchronized (LIFECYCLE_LOCK) {
            if (manager == null) {
                manager = new WebcamManager(createBackend(options), resolutions(), options);
            } else {
                logger.debug("Reusing running webcam manager, ignoring new options");
            }
            openHandles++;
            return new LibraryHandle(manager);
        }
    }

    /**
     * The running manager, if any handle keeps the library alive.
     */
    public static Optional<WebcamManager> manager() {
        synchronized (LIFECYCLE_LOCK) {
            return Optional.ofNullable(manager);
        }
    }

    /**
     * Create the capture backend for the current platform.
     * @throws UnsupportedOperationException if the current platform is not supported
     * @throws RuntimeException if a platform is supported but initialization fails
     */
    public static WebcamBackend createBackend(WebcamOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        logger.debug("Creating webcam backend for platform={}", getPlatformName());
        List<BackendProbe> probes = probeBackends();
        for (BackendProbe probe : probes) {
            if (probe.support().available()) {
                logger.info("Using webcam backend {}", probe.provider().platformId());
                return probe.provider().create(options);
            }
        }
        throw new UnsupportedOperationException(unsupportedReason(probes));
    }

    /**
     * @return linux, macos, windows or unknown
     */
    public static String getPlatformName() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("nix") || os.contains("nux")) {
            return "linux";
        } else if (os.contains("mac")) {
            return "macos";
        } else if (os.contains("win")) {
            return "windows";
        } else {
            return "unknown";
        }
    }

    /**
     * The backend {@link #keepAlive()} would use, or why webcams cannot be captured here.
     */
    public static PlatformSupport getCurrentPlatformSupport() {
        List<BackendProbe> probes = probeBackends();
        return probes.stream()
                .map(BackendProbe::support)
                .filter(PlatformSupport::available)
                .findFirst()
                .orElseGet(() -> PlatformSupport.unavailable(getPlatformName(), unsupportedReason(probes)));
    }

    // Backends for this OS in platform id order, each probed once.
    private static List<BackendProbe> probeBackends() {
        List<BackendProbe> probes = new ArrayList<>();
        loadProviders().stream()
                .filter(WebcamBackendProvider::supportsCurrentOs)
                .sorted(Comparator.comparing(WebcamBackendProvider::platformId))
                .forEach(provider -> {
                    PlatformSupport support = provider.probeSupport();
                    logger.debug("Probed webcam backend {}", support.describe());
                    probes.add(new BackendProbe(provider, support));
                });
        return probes;
    }

    private static String unsupportedReason(List<BackendProbe> probes) {
        if (probes.isEmpty()) {
            return "No webcam backend on classpath for platform: " + getPlatformName();
        }
        return "No webcam backend is available at runtime: " + probes.stream()
                .map(probe -> probe.support().describe())
                .collect(Collectors.joining("; "));
    }

    // The manager is closed under the lock so the next keepAlive cannot bind while it still runs.
    private static void releaseHandle() {
        synchronized (LIFECYCLE_LOCK) {
            openHandles--;
            if (openHandles == 0 && manager != null) {
                manager.close();
                manager = null;
            }
        }
    }

    private static List<WebcamBackendProvider> loadProviders() {
        ServiceLoader<WebcamBackendProvider> loader = ServiceLoader.load(WebcamBackendProvider.class);
        List<WebcamBackendProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered webcam backends: {}",
                    providers.stream().map(WebcamBackendProvider::platformId).collect(Collectors.joining(", ")));
        }
        return providers;
    }

    /**
     * Keeps the library running until closed. Closing is idempotent.
     */
    public static final class LibraryHandle implements AutoCloseable {
        private final WebcamManager manager;
        private final AtomicBoolean closed = new AtomicBoolean();

        private LibraryHandle(WebcamManager manager) {
            this.manager = manager;
        }

        public WebcamManager manager() {
            if (closed.get()) {
                throw new IllegalStateException("Library handle is closed");
            }
            return manager;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                releaseHandle();
            }
        }
    }

    private record BackendProbe(WebcamBackendProvider provider, PlatformSupport support) {}
}
