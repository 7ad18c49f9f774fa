package org.endlesssource.wcam.spi;

import org.endlesssource.wcam.PlatformSupport;
import org.endlesssource.wcam.api.WebcamOptions;

/**
 * SPI implemented by platform-specific modules.
 */
public interface WebcamBackendProvider {

    /**
     * Stable platform id, e.g. linux/windows/macos.
     */
    String platformId();

    /**
     * True when this provider targets the current operating system.
     */
    boolean supportsCurrentOs();

    /**
     * Probe runtime availability (native libraries, helper tools).
     */
    PlatformSupport probeSupport();

    /**
     * Create the platform capture backend.
     */
    WebcamBackend create(WebcamOptions options);
}
