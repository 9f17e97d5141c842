package com.dpstore.backend;

import java.util.Locale;
import java.util.Optional;

/**
 * Backend product names recognized in the configuration file.
 * Only some of them ship with an adapter in this distribution.
 */
public enum BackendType {

    MEMORY("memory", true),
    DPS_SERVER("dps-server", true),
    MEMCACHED("memcached", false),
    REDIS("redis", false),
    CASSANDRA("cassandra", false),
    CLOUDANT("cloudant", false),
    HBASE("hbase", false),
    MONGO("mongo", false),
    COUCHBASE("couchbase", false),
    AEROSPIKE("aerospike", false),
    REDIS_CLUSTER("redis-cluster", false),
    REDIS_CLUSTER_PLUS_PLUS("redis-cluster-plus-plus", false);

    private final String productName;
    private final boolean supported;

    BackendType(String productName, boolean supported) {
        this.productName = productName;
        this.supported = supported;
    }

    public String getProductName() {
        return productName;
    }

    public boolean isSupported() {
        return supported;
    }

    /**
     * Find the type for a product name, ignoring case and surrounding whitespace.
     */
    public static Optional<BackendType> fromProductName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (BackendType type : values()) {
            if (type.productName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
