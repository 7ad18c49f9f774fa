package org.endlesssource.wcam.api;

import java.util.Comparator;

/**
 * A capture mode, expressed as a frame size in pixels.
 */
public record Resolution(int width, int height) {

    /**
     * Safe fallback used when a device is unknown or reports no resolution.
     */
    public static final Resolution DEGENERATE = new Resolution(1, 1);

    /**
     * Largest pixel count first; equal pixel counts put the wider resolution first.
     */
    public static final Comparator<Resolution> LARGEST_FIRST = Comparator
            .comparingLong(Resolution::pixelCount).reversed()
            .thenComparing(Comparator.comparingInt(Resolution::width).reversed());

    public Resolution {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("resolution must be positive, got " + width + "x" + height);
        }
    }

    public long pixelCount() {
        return (long) width * height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
