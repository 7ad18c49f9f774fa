package org.endlesssource.wcam.examples;

import org.endlesssource.wcam.CaptureState;
import org.endlesssource.wcam.PlatformSupport;
import org.endlesssource.wcam.ResolutionsManager;
import org.endlesssource.wcam.SharedWebcam;
import org.endlesssource.wcam.WebcamLibrary;
import org.endlesssource.wcam.WebcamManager;
import org.endlesssource.wcam.api.Resolution;
import org.endlesssource.wcam.api.WebcamInfo;
import org.endlesssource.wcam.api.WebcamOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Cycles the first webcam through every resolution it supports and logs the resulting capture state.
 */
public final class ResolutionSwitchExample {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionSwitchExample.class);

    public static void main(String[] args) {
        PlatformSupport support = WebcamLibrary.getCurrentPlatformSupport();
        if (!support.available()) {
            logger.warn("Unsupported platform: {}", WebcamLibrary.getPlatformName());
            logger.warn("Reason: {}", support.reason());
            return;
        }

        WebcamOptions options = WebcamOptions.defaults()
                .withTickInterval(Duration.ofMillis(50))
                .withCommandTimeout(Duration.ofSeconds(3));

        try (WebcamLibrary.LibraryHandle library = WebcamLibrary.keepAlive(options)) {
            WebcamManager manager = library.manager();
            Thread.sleep(500);
            if (manager.infos().isEmpty()) {
                logger.info("no webcam found");
                return;
            }
            WebcamInfo info = manager.infos().get(0);
            ResolutionsManager resolutions = WebcamLibrary.resolutions();
            logger.info("Switching {} through {}", info.name(), info.resolutions());

            try (SharedWebcam webcam = manager.openOrGetWebcam(info.id())) {
                for (Resolution resolution : info.resolutions()) {
                    resolutions.setSelectedResolution(info.id(), resolution);
                    Thread.sleep(1500);
                    logger.info("{} -> {}", resolution, describe(webcam.state()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(0);
        }
    }

    private static String describe(CaptureState state) {
        if (state instanceof CaptureState.Active active) {
            return "capturing at " + active.resolution();
        }
        if (state instanceof CaptureState.Failed failed) {
            return "failed: " + failed.error().message();
        }
        return "not initialized";
    }

    private ResolutionSwitchExample() {
    }
}
