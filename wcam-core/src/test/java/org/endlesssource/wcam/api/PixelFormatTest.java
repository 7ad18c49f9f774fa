package org.endlesssource.wcam.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PixelFormatTest {
    private static final Resolution VGA = new Resolution(640, 480);

    @Test
    void packedFormats_useThreeBytesPerPixel() {
        assertEquals(921_600, PixelFormat.RGB24.frameSize(VGA));
        assertEquals(921_600, PixelFormat.BGR24.frameSize(VGA));
    }

    @Test
    void nv12_usesHalfResolutionChromaPlane() {
        assertEquals(460_800, PixelFormat.NV12.frameSize(VGA));
        assertEquals(6, PixelFormat.NV12.frameSize(new Resolution(2, 2)));
    }

    @Test
    void image_rejectsBufferShorterThanFrame() {
        assertThrows(IllegalArgumentException.class,
                () -> new Image(VGA, PixelFormat.NV12, new byte[460_799], Instant.now()));
        Image image = new Image(VGA, PixelFormat.NV12, new byte[460_800], Instant.now());
        assertEquals(PixelFormat.NV12, image.pixelFormat());
    }
}
