package org.endlesssource.wcam.examples;

import org.endlesssource.wcam.PlatformSupport;
import org.endlesssource.wcam.SharedWebcam;
import org.endlesssource.wcam.WebcamLibrary;
import org.endlesssource.wcam.WebcamManager;
import org.endlesssource.wcam.api.CaptureError;
import org.endlesssource.wcam.api.Image;
import org.endlesssource.wcam.api.MaybeImage;
import org.endlesssource.wcam.api.WebcamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class WebcamLoggerExample {
    private static final Logger logger = LoggerFactory.getLogger(WebcamLoggerExample.class);

    public static void main(String[] args) {
        PlatformSupport support = WebcamLibrary.getCurrentPlatformSupport();
        if (!support.available()) {
            logger.warn("Unsupported platform: {}", WebcamLibrary.getPlatformName());
            logger.warn("Reason: {}", support.reason());
            return;
        }

        try (WebcamLibrary.LibraryHandle library = WebcamLibrary.keepAlive()) {
            WebcamManager manager = library.manager();
            List<WebcamInfo> infos = awaitDevices(manager);
            if (infos.isEmpty()) {
                logger.info("no webcam found");
                return;
            }
            infos.forEach(info -> logger.info("{} [{}] {}", info.name(), info.id(), info.resolutions()));

            WebcamInfo first = infos.get(0);
            try (SharedWebcam webcam = manager.openOrGetWebcam(first.id())) {
                while (true) {
                    MaybeImage image = webcam.image();
                    if (image instanceof Image frame) {
                        logger.info("[{}] frame {} {} ({} bytes)", first.name(), frame.resolution(),
                                frame.pixelFormat(), frame.pixels().length);
                    } else if (image instanceof CaptureError error) {
                        logger.info("[{}] {}", first.name(), error.message());
                    } else {
                        logger.info("[{}] waiting for frames", first.name());
                    }
                    Thread.sleep(1000);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(0);
        }
    }

    private static List<WebcamInfo> awaitDevices(WebcamManager manager) throws InterruptedException {
        for (int attempt = 0; attempt < 20 && manager.infos().isEmpty(); attempt++) {
            Thread.sleep(100);
        }
        return manager.infos();
    }

    private WebcamLoggerExample() {
    }
}
