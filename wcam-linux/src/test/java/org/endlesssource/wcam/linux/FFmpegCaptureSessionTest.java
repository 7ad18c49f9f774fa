package org.endlesssource.wcam.linux;

import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Image;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.PixelFormat;
import org.endlesssource.wcam.api.Resolution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class FFmpegCaptureSessionTest {
    private static final Resolution SIZE = new Resolution(4, 2);
    private static final DeviceId ID = DeviceId.of("usb-cam");

    @TempDir
    Path dev;

    @Test
    void grabbedFrame_isDeliveredOnce() throws Exception {
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node());
        try {
            Image frame = frame();
            source.steps.put(() -> frame);

            awaitCondition(() -> session.image() == frame);
            assertEquals(MaybeImage.NO_NEW_IMAGE_YET, session.image());
            assertEquals(SIZE, session.resolution());
            assertTrue(session.failure().isEmpty());
        } finally {
            source.stop();
            session.close();
        }
        assertTrue(source.released.await(5, TimeUnit.SECONDS));
    }

    @Test
    void close_stopsGrabbingAndReleasesSource() throws Exception {
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node());

        source.stop();
        session.close();

        assertTrue(source.released.await(5, TimeUnit.SECONDS));
        assertEquals(MaybeImage.NO_NEW_IMAGE_YET, session.image());
        session.close();
    }

    @Test
    void linkageErrorWhileGrabbing_isReportedAsFailure() throws Exception {
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node());
        try {
            source.steps.put(() -> {
                throw new UnsatisfiedLinkError("no jniavcodec in java.library.path");
            });

            awaitCondition(() -> session.failure().isPresent());
            CaptureError error = session.failure().orElseThrow();
            assertInstanceOf(CaptureError.Other.class, error);
            assertTrue(error.message().contains("no jniavcodec"));
            assertTrue(source.released.await(5, TimeUnit.SECONDS));
        } finally {
            source.stop();
            session.close();
        }
    }

    @Test
    void busyDeviceWhileGrabbing_isAlreadyInUse() throws Exception {
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node());
        try {
            source.steps.put(() -> {
                throw new IOException("av_read_frame() error -16: Could not read frame");
            });

            awaitCondition(() -> session.failure().isPresent());
            assertEquals(CaptureError.ALREADY_IN_USE, session.failure().orElseThrow());
        } finally {
            source.stop();
            session.close();
        }
    }

    @Test
    void failureAfterNodeVanished_isUnplugged() throws Exception {
        Path node = node();
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node);
        try {
            Files.delete(node);
            source.steps.put(() -> {
                throw new IOException("av_read_frame() error -5: Could not read frame");
            });

            awaitCondition(() -> session.failure().isPresent());
            assertEquals(CaptureError.UNPLUGGED, session.failure().orElseThrow());
        } finally {
            source.stop();
            session.close();
        }
    }

    @Test
    void endOfStream_isReportedAsFailure() throws Exception {
        ScriptedSource source = new ScriptedSource();
        FFmpegCaptureSession session = start(source, node());
        try {
            source.steps.put(() -> null);

            awaitCondition(() -> session.failure().isPresent());
            assertTrue(session.failure().orElseThrow().message().contains("ended"));
        } finally {
            source.stop();
            session.close();
        }
    }

    private Path node() throws IOException {
        return Files.createFile(dev.resolve("video" + System.nanoTime()));
    }

    private static FFmpegCaptureSession start(ScriptedSource source, Path node) {
        FFmpegCaptureSession session = new FFmpegCaptureSession(ID, node.toString(), SIZE, source);
        session.start();
        return session;
    }

    private static Image frame() {
        return new Image(SIZE, PixelFormat.BGR24, new byte[(int) PixelFormat.BGR24.frameSize(SIZE)], Instant.now());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(2);
        }
    }

    @FunctionalInterface
    private interface Step {
        Image run() throws Exception;
    }

    /**
     * Plays queued steps in order. With nothing queued it blocks like a camera waiting for its next frame,
     * until {@link #stop()} ends the stream.
     */
    private static final class ScriptedSource implements FFmpegCaptureSession.FrameSource {
        private final BlockingQueue<Step> steps = new LinkedBlockingQueue<>();
        private final CountDownLatch released = new CountDownLatch(1);
        private volatile boolean stopped;

        @Override
        public Image grab() throws Exception {
            while (!stopped) {
                Step step = steps.poll(5, TimeUnit.MILLISECONDS);
                if (step != null) {
                    return step.run();
                }
            }
            return null;
        }

        @Override
        public void release() {
            released.countDown();
        }

        void stop() {
            stopped = true;
        }
    }
}
