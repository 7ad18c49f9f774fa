package org.endlesssource.wcam;

import java.util.Objects;

/**
 * Whether webcams can be captured on the running machine, and through which backend.
 *
 * @param backend   id of the probed backend, or the OS name when no backend module is installed
 * @param available whether the backend can be created right now
 * @param reason    why capture is not possible, empty when available
 */
public record PlatformSupport(String backend, boolean available, String reason) {
    public PlatformSupport {
        Objects.requireNonNull(backend, "backend must not be null");
        reason = reason == null ? "" : reason;
    }

    public static PlatformSupport available(String backend) {
        return new PlatformSupport(backend, true, "");
    }

    public static PlatformSupport unavailable(String backend, String reason) {
        return new PlatformSupport(backend, false, reason);
    }

    String describe() {
        return available ? backend + ": available" : backend + ": " + reason;
    }
}
