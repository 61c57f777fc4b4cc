package com.questrail.lantern.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoint of the external scoring service that receives signal values.
 *
 * <p>{@code host} and {@code apiKey} may be absent. An unconfigured client is
 * still constructed; it fails every push instead.</p>
 */
public record SignalSyncConfig(
        String host,
        int port,
        String path,
        String apiKey,
        Duration requestTimeout
) {
    public static final int DEFAULT_PORT = 80;
    public static final String DEFAULT_PATH = "/reports/set_boost";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public SignalSyncConfig {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static SignalSyncConfig of(String host, String apiKey) {
        return new SignalSyncConfig(host, DEFAULT_PORT, DEFAULT_PATH, apiKey, DEFAULT_TIMEOUT);
    }

    public static SignalSyncConfig unconfigured() {
        return of(null, null);
    }

    public boolean isConfigured() {
        return host != null && !host.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public SignalSyncConfig withPort(int newPort) {
        return new SignalSyncConfig(host, newPort, path, apiKey, requestTimeout);
    }

    public SignalSyncConfig withRequestTimeout(Duration timeout) {
        return new SignalSyncConfig(host, port, path, apiKey, timeout);
    }
}
