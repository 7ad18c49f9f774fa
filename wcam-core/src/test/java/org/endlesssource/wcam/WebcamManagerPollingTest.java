package org.endlesssource.wcam;

import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamOptions;
import org.endlesssource.wcam.test.FakeWebcamBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the manager with its own polling thread running.
 */
class WebcamManagerPollingTest {
    private static final Resolution VGA = new Resolution(640, 480);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeWebcamBackend backend;
    private WebcamManager manager;

    @BeforeEach
    void setUp() {
        backend = new FakeWebcamBackend();
        manager = new WebcamManager(backend, new ResolutionsManager(),
                WebcamOptions.defaults().withTickInterval(Duration.ofMillis(5)));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void concurrentOpens_shareOneRequestAndOneSession() throws Exception {
        DeviceId cam = backend.plug("cam", VGA);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SharedWebcam>> futures = new ArrayList<>();
        try (SharedWebcam anchor = manager.openOrGetWebcam(cam)) {
            for (int i = 0; i < threads; i++) {
                Callable<SharedWebcam> open = () -> {
                    start.await();
                    return manager.openOrGetWebcam(cam);
                };
                futures.add(pool.submit(open));
            }
            start.countDown();

            List<SharedWebcam> handles = new ArrayList<>();
            for (Future<SharedWebcam> future : futures) {
                handles.add(future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
            }
            for (SharedWebcam handle : handles) {
                assertSame(anchor.request(), handle.request());
            }

            awaitCondition(() -> anchor.state() instanceof CaptureState.Active);
            assertEquals(1, backend.sessionsFor(cam).size());
            assertEquals(1, backend.openSessionsFor(cam));
            handles.forEach(SharedWebcam::close);
            assertEquals(1, backend.openSessionsFor(cam));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, backend.openSessionsFor(cam));
    }

    @Test
    void churningHandles_neverOpenTwoSessionsAtOnce() throws Exception {
        DeviceId cam = backend.plug("cam", VGA);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    long worst = 0;
                    for (int round = 0; round < 200; round++) {
                        try (SharedWebcam webcam = manager.openOrGetWebcam(cam)) {
                            webcam.image();
                            worst = Math.max(worst, backend.openSessionsFor(cam));
                        }
                    }
                    return worst;
                }));
            }
            start.countDown();
            for (Future<Long> future : futures) {
                assertTrue(future.get(30, TimeUnit.SECONDS) <= 1);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unpluggedDevice_recoversWithoutConsumerAction() {
        DeviceId cam = backend.plug("cam", VGA);
        try (SharedWebcam webcam = manager.openOrGetWebcam(cam)) {
            awaitCondition(() -> webcam.state() instanceof CaptureState.Active);

            backend.unplug(cam);
            awaitCondition(() -> webcam.state() instanceof CaptureState.Failed);

            backend.plug("cam", VGA);
            awaitCondition(() -> webcam.state() instanceof CaptureState.Active);
            assertEquals(1, backend.openSessionsFor(cam));
        }
    }

    @Test
    void errorFromOpen_doesNotStopPolling() {
        DeviceId cam = backend.plug("cam", VGA);
        backend.crashOpensWith(new UnsatisfiedLinkError("no jniavformat in java.library.path"));
        try (SharedWebcam webcam = manager.openOrGetWebcam(cam)) {
            awaitCondition(() -> webcam.state() instanceof CaptureState.Failed);
            int enumerations = backend.enumerations();

            DeviceId other = backend.plug("other", VGA);
            awaitCondition(() -> manager.isPluggedIn(other));
            assertTrue(backend.enumerations() > enumerations);

            backend.crashOpensWith(null);
            awaitCondition(() -> webcam.state() instanceof CaptureState.Active);
        }
    }

    @Test
    void close_stopsPollingBeforeReturning() {
        awaitCondition(() -> backend.enumerations() > 0);

        manager.close();
        int afterClose = backend.enumerations();
        sleep(50);

        assertEquals(afterClose, backend.enumerations());
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + TIMEOUT);
            }
            sleep(2);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }
}
