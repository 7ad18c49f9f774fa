package org.endlesssource.wcam.api;

/**
 * Pixel layout of an {@link Image} buffer.
 */
public enum PixelFormat {
    RGB24 {
        @Override
        public long frameSize(Resolution resolution) {
            return resolution.pixelCount() * 3;
        }
    },
    BGR24 {
        @Override
        public long frameSize(Resolution resolution) {
            return resolution.pixelCount() * 3;
        }
    },
    /** 8 bit Y plane followed by an interleaved, half resolution UV plane. */
    NV12 {
        @Override
        public long frameSize(Resolution resolution) {
            return resolution.pixelCount() * 3 / 2;
        }
    };

    /**
     * Expected buffer size for one frame at the given resolution.
     */
    public abstract long frameSize(Resolution resolution);
}
