package org.endlesssource.wcam.linux;

import org.endlesssource.wcam.PlatformSupport;
import org.endlesssource.wcam.api.WebcamOptions;
import org.endlesssource.wcam.spi.WebcamBackend;
import org.endlesssource.wcam.spi.WebcamBackendProvider;

public final class LinuxBackendProvider implements WebcamBackendProvider {
    @Override
    public String platformId() {
        return "linux";
    }

    @Override
    public boolean supportsCurrentOs() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("nix") || os.contains("nux");
    }

    @Override
    public PlatformSupport probeSupport() {
        if (!supportsCurrentOs()) {
            return PlatformSupport.unavailable(platformId(), "Current OS is not Linux");
        }
        if (V4l2Ctl.findExecutable().isEmpty()) {
            return PlatformSupport.unavailable(platformId(), "v4l2-ctl not found on PATH (install v4l-utils)");
        }
        try {
            Class.forName("org.bytedeco.javacv.FFmpegFrameGrabber", false, getClass().getClassLoader());
            return PlatformSupport.available(platformId());
        } catch (ClassNotFoundException e) {
            return PlatformSupport.unavailable(platformId(), "Missing JavaCV runtime classes");
        }
    }

    @Override
    public WebcamBackend create(WebcamOptions options) {
        return new LinuxWebcamBackend(new V4l2Ctl(options.getCommandTimeout()));
    }
}
