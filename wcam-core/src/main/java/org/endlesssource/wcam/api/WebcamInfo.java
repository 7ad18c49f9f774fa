package org.endlesssource.wcam.api;

import java.util.List;
import java.util.Objects;

/**
 * A device as seen by one enumeration pass.
 *
 * @param name        human readable device name
 * @param id          stable device identity
 * @param resolutions supported resolutions, largest first once published by the manager
 */
public record WebcamInfo(String name, DeviceId id, List<Resolution> resolutions) {
    public WebcamInfo(String name, DeviceId id, List<Resolution> resolutions) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.resolutions = List.copyOf(Objects.requireNonNull(resolutions, "resolutions must not be null"));
    }

    /**
     * Copy of this info with resolutions de-duplicated and ordered by {@link Resolution#LARGEST_FIRST}.
     */
    public WebcamInfo normalized() {
        List<Resolution> sorted = resolutions.stream()
                .distinct()
                .sorted(Resolution.LARGEST_FIRST)
                .toList();
        return new WebcamInfo(name, id, sorted);
    }
}
