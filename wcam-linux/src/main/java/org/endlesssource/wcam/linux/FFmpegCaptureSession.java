package org.endlesssource.wcam.linux;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.DeviceId;
import org.endlesssource.wcam.api.Image;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.PixelFormat;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.spi.CaptureException;
import org.endlesssource.wcam.spi.CaptureSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Capture of one V4L2 node through FFmpeg. A daemon thread owns the frame source: it grabs frames into a
 * single slot and releases the source when the session is closed or the stream breaks.
 */
final class FFmpegCaptureSession implements CaptureSession {
    private static final Logger logger = LoggerFactory.getLogger(FFmpegCaptureSession.class);
    private static final long JOIN_TIMEOUT_MS = 2000;

    private final DeviceId id;
    private final String node;
    private final Resolution resolution;
    private final FrameSource source;
    private final Thread grabberThread;

    private final Object frameLock = new Object();
    private Image latest;

    private volatile CaptureError failure;
    private volatile boolean running = true;

    FFmpegCaptureSession(DeviceId id, String node, Resolution resolution, FrameSource source) {
        this.id = id;
        this.node = node;
        this.resolution = resolution;
        this.source = source;
        this.grabberThread = new Thread(this::grabLoop, "wcam-grabber-" + node);
        this.grabberThread.setDaemon(true);
    }

    static FFmpegCaptureSession open(DeviceId id, String node, Resolution requested) throws CaptureException {
        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(node);
        grabber.setFormat("video4linux2");
        grabber.setImageWidth(requested.width());
        grabber.setImageHeight(requested.height());
        grabber.setPixelFormat(avutil.AV_PIX_FMT_BGR24);
        grabber.setImageMode(FrameGrabber.ImageMode.COLOR);
        try {
            grabber.start();
        } catch (FrameGrabber.Exception e) {
            GrabberSource.releaseQuietly(grabber, node);
            throw new CaptureException(V4l2Errors.classify(e.getMessage(), Files.exists(Path.of(node))), e);
        }
        Resolution negotiated = new Resolution(grabber.getImageWidth(), grabber.getImageHeight());
        if (!negotiated.equals(requested)) {
            logger.debug("{} delivers {} instead of requested {}", id, negotiated, requested);
        }
        FFmpegCaptureSession session = new FFmpegCaptureSession(id, node, negotiated, new GrabberSource(grabber, node));
        session.start();
        return session;
    }

    void start() {
        grabberThread.start();
    }

    @Override
    public MaybeImage image() {
        synchronized (frameLock) {
            Image image = latest;
            if (image == null) {
                return MaybeImage.NO_NEW_IMAGE_YET;
            }
            latest = null;
            return image;
        }
    }

    @Override
    public Resolution resolution() {
        return resolution;
    }

    @Override
    public Optional<CaptureError> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            grabberThread.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (grabberThread.isAlive()) {
            logger.warn("Grabber thread for {} did not stop within {} ms", id, JOIN_TIMEOUT_MS);
            grabberThread.interrupt();
        }
    }

    private void grabLoop() {
        try {
            while (running) {
                Image image = source.grab();
                if (image == null) {
                    if (running) {
                        failure = CaptureError.other("Video stream of " + node + " ended");
                    }
                    return;
                }
                synchronized (frameLock) {
                    latest = image;
                }
            }
        } catch (VirtualMachineError e) {
            failure = CaptureError.other(e.toString());
            throw e;
        } catch (Exception e) {
            if (running) {
                failure = V4l2Errors.classify(e.getMessage(), Files.exists(Path.of(node)));
                logger.debug("Grabbing from {} failed: {}", id, e.getMessage());
            }
        } catch (Throwable e) {
            // native and linkage errors end this session only; the manager reopens it
            logger.warn("Unexpected failure while grabbing from {}", id, e);
            failure = CaptureError.other(e.toString());
        } finally {
            source.release();
        }
    }

    /**
     * Frames of one opened device, used only by the grabber thread.
     */
    interface FrameSource {
        /**
         * Blocks for the next frame; {@code null} at the end of the stream.
         */
        Image grab() throws Exception;

        /**
         * Stops the device. Must not throw.
         */
        void release();
    }

    private static final class GrabberSource implements FrameSource {
        private final FFmpegFrameGrabber grabber;
        private final String node;

        private GrabberSource(FFmpegFrameGrabber grabber, String node) {
            this.grabber = grabber;
            this.node = node;
        }

        @Override
        public Image grab() throws FrameGrabber.Exception {
            while (true) {
                Frame frame = grabber.grabImage();
                if (frame == null) {
                    return null;
                }
                if (frame.image != null) {
                    return toImage(frame);
                }
            }
        }

        @Override
        public void release() {
            releaseQuietly(grabber, node);
        }

        /**
         * Copies a packed BGR24 frame, dropping the row padding FFmpeg may add.
         */
        private static Image toImage(Frame frame) {
            int width = frame.imageWidth;
            int height = frame.imageHeight;
            int rowBytes = width * 3;
            ByteBuffer buffer = (ByteBuffer) frame.image[0];
            byte[] pixels = new byte[rowBytes * height];
            for (int y = 0; y < height; y++) {
                buffer.get(y * frame.imageStride, pixels, y * rowBytes, rowBytes);
            }
            return new Image(new Resolution(width, height), PixelFormat.BGR24, pixels, Instant.now());
        }

        private static void releaseQuietly(FFmpegFrameGrabber grabber, String node) {
            try {
                grabber.close();
            } catch (FrameGrabber.Exception e) {
                logger.warn("Failed to release grabber for {}: {}", node, e.getMessage());
            }
        }
    }
}
