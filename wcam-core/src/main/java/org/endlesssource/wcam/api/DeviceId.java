package org.endlesssource.wcam.api;

import java.util.Objects;

/**
 * Stable identity of a physical capture device.
 * Backends derive it from the device path when there is one, otherwise from the friendly name,
 * so that unplugging and replugging the same device yields an equal id.
 */
public record DeviceId(String value) {
    public DeviceId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("device id must not be blank");
        }
    }

    public static DeviceId of(String value) {
        return new DeviceId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
