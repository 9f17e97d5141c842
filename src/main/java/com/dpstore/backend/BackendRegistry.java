package com.dpstore.backend;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.backend.remote.RemoteBackend;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps backend product names to adapter factories.
 */
public class BackendRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, Supplier<BackendAdapter>> factories = new ConcurrentHashMap<>();

    /**
     * Create a registry holding the adapters shipped with this distribution.
     */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(BackendType.MEMORY.getProductName(), InMemoryBackend::new);
        registry.register(BackendType.DPS_SERVER.getProductName(), RemoteBackend::new);
        return registry;
    }

    /**
     * Register or replace a factory.
     */
    public void register(String name, Supplier<BackendAdapter> factory) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Backend name cannot be null or empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Factory cannot be null");
        }
        factories.put(normalize(name), factory);
    }

    public boolean isRegistered(String name) {
        return name != null && factories.containsKey(normalize(name));
    }

    public Set<String> getRegisteredNames() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * Create a new adapter for a product name.
     *
     * @throws DpsException with DPS_INITIALIZE_ERROR if the name is unknown or has no adapter
     */
    public BackendAdapter create(String name) throws DpsException {
        if (name == null || name.trim().isEmpty()) {
            throw new DpsException(ErrorCode.DPS_INITIALIZE_ERROR, "No backend product name configured");
        }
        Supplier<BackendAdapter> factory = factories.get(normalize(name));
        if (factory != null) {
            logger.debug("Creating backend adapter for {}", name);
            return factory.get();
        }
        if (BackendType.fromProductName(name).isPresent()) {
            throw new DpsException(ErrorCode.DPS_INITIALIZE_ERROR,
                    "Backend '" + name + "' is unsupported in this distribution; available: " + getRegisteredNames());
        }
        throw new DpsException(ErrorCode.DPS_INITIALIZE_ERROR,
                "Unknown backend '" + name + "'; available: " + getRegisteredNames());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
