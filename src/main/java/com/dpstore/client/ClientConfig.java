package com.dpstore.client;

import com.dpstore.config.DpsConfig;

/**
 * Connection tuning for the dps-server backend adapter, applied to every server.
 * Per-server settings (password, connect timeout) come from the server entries
 * of the config file. Instances are immutable; use {@link #builder()}.
 */
public final class ClientConfig {

    public static final int DEFAULT_READ_TIMEOUT_MS = 30000;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_SERVER = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 100;

    private final int readTimeoutMs;
    private final int maxConnectionsPerServer;
    private final int maxRetries;
    private final long retryDelayMs;
    private final boolean retryOnFailure;

    private ClientConfig(Builder builder) {
        this.readTimeoutMs = builder.readTimeoutMs;
        this.maxConnectionsPerServer = builder.maxConnectionsPerServer;
        this.maxRetries = builder.maxRetries;
        this.retryDelayMs = builder.retryDelayMs;
        this.retryOnFailure = builder.retryOnFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by DPSTORE_CLIENT_READ_TIMEOUT_MS, DPSTORE_CLIENT_MAX_CONNECTIONS
     * and DPSTORE_CLIENT_MAX_RETRIES (or the matching dpstore.client.* properties).
     */
    public static ClientConfig fromEnvironment() {
        return builder()
            .readTimeoutMs(DpsConfig.readIntSetting("DPSTORE_CLIENT_READ_TIMEOUT_MS",
                "dpstore.client.read.timeout.ms", DEFAULT_READ_TIMEOUT_MS))
            .maxConnectionsPerServer(DpsConfig.readIntSetting("DPSTORE_CLIENT_MAX_CONNECTIONS",
                "dpstore.client.max.connections", DEFAULT_MAX_CONNECTIONS_PER_SERVER))
            .maxRetries(DpsConfig.readIntSetting("DPSTORE_CLIENT_MAX_RETRIES",
                "dpstore.client.max.retries", DEFAULT_MAX_RETRIES))
            .build();
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public int getMaxConnectionsPerServer() {
        return maxConnectionsPerServer;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public boolean isRetryOnFailure() {
        return retryOnFailure;
    }

    /**
     * Number of times a keyed request is sent before its failure is reported.
     */
    public int attemptsPerRequest() {
        return retryOnFailure ? Math.max(1, maxRetries) : 1;
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
               "readTimeoutMs=" + readTimeoutMs +
               ", maxConnectionsPerServer=" + maxConnectionsPerServer +
               ", maxRetries=" + maxRetries +
               ", retryDelayMs=" + retryDelayMs +
               ", retryOnFailure=" + retryOnFailure +
               '}';
    }

    public static final class Builder {
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        private int maxConnectionsPerServer = DEFAULT_MAX_CONNECTIONS_PER_SERVER;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private boolean retryOnFailure = true;

        private Builder() {
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = positive("readTimeoutMs", readTimeoutMs);
            return this;
        }

        public Builder maxConnectionsPerServer(int maxConnectionsPerServer) {
            this.maxConnectionsPerServer = positive("maxConnectionsPerServer", maxConnectionsPerServer);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be non-negative, got: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be non-negative, got: " + retryDelayMs);
            }
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder retryOnFailure(boolean retryOnFailure) {
            this.retryOnFailure = retryOnFailure;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }

        private static int positive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
            return value;
        }
    }
}
