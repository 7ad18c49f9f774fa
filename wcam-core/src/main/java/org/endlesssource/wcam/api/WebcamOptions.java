package org.endlesssource.wcam.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for the webcam manager and its backend.
 */
public final class WebcamOptions {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private final boolean backgroundPollingEnabled;
    private final Duration tickInterval;
    private final Duration shutdownTimeout;
    private final Duration commandTimeout;

    private WebcamOptions(boolean backgroundPollingEnabled,
                          Duration tickInterval,
                          Duration shutdownTimeout,
                          Duration commandTimeout) {
        this.backgroundPollingEnabled = backgroundPollingEnabled;
        this.tickInterval = requirePositive("tickInterval", tickInterval);
        this.shutdownTimeout = requirePositive("shutdownTimeout", shutdownTimeout);
        this.commandTimeout = requirePositive("commandTimeout", commandTimeout);
    }

    public static WebcamOptions defaults() {
        return new WebcamOptions(true, DEFAULT_TICK_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT, DEFAULT_COMMAND_TIMEOUT);
    }

    /**
     * Whether the manager runs its own polling thread.
     * When disabled, the owner drives the manager by calling {@code update()} itself.
     */
    public boolean isBackgroundPollingEnabled() {
        return backgroundPollingEnabled;
    }

    /**
     * Pause between two polling iterations.
     */
    public Duration getTickInterval() {
        return tickInterval;
    }

    /**
     * How long closing the manager waits for an in-flight iteration.
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Upper bound for helper processes a backend runs while enumerating.
     */
    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public WebcamOptions withBackgroundPollingEnabled(boolean enabled) {
        return new WebcamOptions(enabled, tickInterval, shutdownTimeout, commandTimeout);
    }

    public WebcamOptions withTickInterval(Duration interval) {
        return new WebcamOptions(backgroundPollingEnabled, interval, shutdownTimeout, commandTimeout);
    }

    public WebcamOptions withShutdownTimeout(Duration timeout) {
        return new WebcamOptions(backgroundPollingEnabled, tickInterval, timeout, commandTimeout);
    }

    public WebcamOptions withCommandTimeout(Duration timeout) {
        return new WebcamOptions(backgroundPollingEnabled, tickInterval, shutdownTimeout, timeout);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
