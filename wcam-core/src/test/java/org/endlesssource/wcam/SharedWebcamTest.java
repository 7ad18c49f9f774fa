package org.endlesssource.wcam;

import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Image;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamOptions;
import org.endlesssource.wcam.test.FakeCaptureSession;
import org.endlesssource.wcam.test.FakeWebcamBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SharedWebcamTest {
    private static final Resolution VGA = new Resolution(640, 480);

    private FakeWebcamBackend backend;
    private WebcamManager manager;
    private DeviceId cam;

    @BeforeEach
    void setUp() {
        backend = new FakeWebcamBackend();
        manager = new WebcamManager(backend, new ResolutionsManager(),
                WebcamOptions.defaults().withBackgroundPollingEnabled(false));
        cam = backend.plug("cam", VGA);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void image_beforeFirstTick_isNotInitialized() {
        try (SharedWebcam webcam = manager.openOrGetWebcam(cam)) {
            assertEquals(MaybeImage.NOT_INITIALIZED_YET, webcam.image());
            assertEquals(cam, webcam.id());
        }
    }

    @Test
    void image_deliversEachFrameOnce() {
        try (SharedWebcam webcam = manager.openOrGetWebcam(cam)) {
            manager.update();
            assertEquals(MaybeImage.NO_NEW_IMAGE_YET, webcam.image());

            Image frame = backend.lastSessionFor(cam).produceFrame();

            assertSame(frame, webcam.image());
            assertEquals(MaybeImage.NO_NEW_IMAGE_YET, webcam.image());
        }
    }

    @Test
    void image_isSharedAcrossHandles() {
        try (SharedWebcam first = manager.openOrGetWebcam(cam);
             SharedWebcam second = first.share()) {
            manager.update();
            Image frame = backend.lastSessionFor(cam).produceFrame();

            assertSame(frame, second.image());
            assertEquals(MaybeImage.NO_NEW_IMAGE_YET, first.image());
        }
    }

    @Test
    void share_keepsCaptureAliveAfterOriginalCloses() {
        SharedWebcam original = manager.openOrGetWebcam(cam);
        manager.update();
        FakeCaptureSession session = backend.lastSessionFor(cam);

        SharedWebcam copy = original.share();
        original.close();
        assertFalse(session.isClosed());
        assertInstanceOf(CaptureState.Active.class, copy.state());

        copy.close();
        assertTrue(session.isClosed());
    }

    @Test
    void close_isIdempotentAndDisablesHandle() {
        SharedWebcam first = manager.openOrGetWebcam(cam);
        SharedWebcam second = manager.openOrGetWebcam(cam);
        manager.update();
        FakeCaptureSession session = backend.lastSessionFor(cam);

        first.close();
        first.close();

        assertTrue(first.isClosed());
        assertFalse(session.isClosed());
        assertThrows(IllegalStateException.class, first::image);
        assertThrows(IllegalStateException.class, first::state);
        assertThrows(IllegalStateException.class, first::share);

        second.close();
        assertTrue(session.isClosed());
    }

    @Test
    void unclosedHandle_isReleasedWhenCollected() throws InterruptedException {
        FakeCaptureSession session = openActiveAndDrop();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!session.isClosed()) {
            if (System.nanoTime() > deadline) {
                fail("Dropped handle was not released by the garbage collector");
            }
            System.gc();
            Thread.sleep(10);
        }

        try (SharedWebcam fresh = manager.openOrGetWebcam(cam)) {
            assertInstanceOf(CaptureState.NotInitialized.class, fresh.state());
            manager.update();
            assertInstanceOf(CaptureState.Active.class, fresh.state());
            assertEquals(2, backend.sessionsFor(cam).size());
            assertEquals(1, backend.openSessionsFor(cam));
        }
    }

    // The handle goes out of scope with this frame.
    private FakeCaptureSession openActiveAndDrop() {
        SharedWebcam webcam = manager.openOrGetWebcam(cam);
        manager.update();
        assertInstanceOf(CaptureState.Active.class, webcam.state());
        return backend.lastSessionFor(cam);
    }
}
