package org.endlesssource.wcam.linux;

import org.endlesssource.wcam.api.CaptureError;

import java.util.Locale;

/**
 * Maps FFmpeg/V4L2 failure messages to capture errors.
 * FFmpeg reports negated errno values, e.g. {@code avformat_open_input() error -16}.
 */
final class V4l2Errors {
    private static final int EBUSY = 16;
    private static final int ENODEV = 19;
    private static final int ENOENT = 2;

    private V4l2Errors() {}

    static CaptureError classify(String message, boolean nodePresent) {
        if (!nodePresent) {
            return CaptureError.UNPLUGGED;
        }
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (text.contains("busy") || text.contains("error -" + EBUSY + ":") || text.endsWith("error -" + EBUSY)) {
            return CaptureError.ALREADY_IN_USE;
        }
        if (text.contains("no such device") || text.contains("error -" + ENODEV + ":")
                || text.contains("error -" + ENOENT + ":")) {
            return CaptureError.UNPLUGGED;
        }
        return CaptureError.other(message);
    }
}
