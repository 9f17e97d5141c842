package com.dpstore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Backend selection and server list.
 *
 * The configuration file names the backend product on its first non-comment line
 * and lists one server entry per following line. Lines starting with '#' and
 * blank lines are ignored.
 *
 * Lookup order for {@link #load()}:
 * - DPSTORE_CONFIG_FILE env var / dpstore.config.file property: path of the file
 * - DPSTORE_BACKEND env var / dpstore.backend property: overrides the product name
 * - otherwise the in-process "memory" backend with no servers
 */
public final class DpsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DpsConfig.class);

    public static final String DEFAULT_BACKEND = "memory";
    public static final int DEFAULT_PORT = 9001;

    private final String backendName;
    private final List<ServerEndpoint> servers;

    public DpsConfig(String backendName, List<ServerEndpoint> servers) {
        if (backendName == null || backendName.trim().isEmpty()) {
            throw new IllegalArgumentException("Backend name cannot be null or empty");
        }
        this.backendName = backendName.trim().toLowerCase();
        this.servers = servers != null
            ? Collections.unmodifiableList(new ArrayList<>(servers))
            : Collections.emptyList();
    }

    /**
     * Create a config for the given backend with no servers.
     */
    public static DpsConfig of(String backendName) {
        return new DpsConfig(backendName, Collections.emptyList());
    }

    /**
     * Create a config for the given backend and servers.
     */
    public static DpsConfig of(String backendName, ServerEndpoint... servers) {
        return new DpsConfig(backendName, List.of(servers));
    }

    /**
     * Parse configuration file contents.
     *
     * @param lines the file lines
     * @return the parsed configuration
     * @throws IllegalArgumentException if no backend name is present or a server entry is malformed
     */
    public static DpsConfig parse(List<String> lines) {
        String backend = null;
        List<ServerEndpoint> servers = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (backend == null) {
                backend = line;
            } else {
                servers.add(ServerEndpoint.parse(line, DEFAULT_PORT));
            }
        }
        if (backend == null) {
            throw new IllegalArgumentException("Configuration does not name a backend product");
        }
        return new DpsConfig(backend, servers);
    }

    /**
     * Read and parse a configuration file.
     *
     * @param path the file path
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static DpsConfig load(Path path) throws IOException {
        DpsConfig config = parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        logger.info("Loaded configuration from {}: backend={}, servers={}",
            path.toAbsolutePath(), config.backendName, config.servers.size());
        return config;
    }

    /**
     * Resolve configuration from environment variables and system properties.
     *
     * @return the resolved configuration
     * @throws IOException if a configured file cannot be read
     */
    public static DpsConfig load() throws IOException {
        DpsConfig config;
        String file = readSetting("DPSTORE_CONFIG_FILE", "dpstore.config.file");
        if (file != null) {
            config = load(Path.of(file));
        } else {
            config = of(DEFAULT_BACKEND);
        }

        String backendOverride = readSetting("DPSTORE_BACKEND", "dpstore.backend");
        if (backendOverride != null && !backendOverride.equalsIgnoreCase(config.backendName)) {
            logger.info("Backend overridden to {} (was {})", backendOverride, config.backendName);
            config = new DpsConfig(backendOverride, config.servers);
        }
        return config;
    }

    /**
     * Read a setting from the environment first, then from system properties.
     *
     * @return the value, or null if neither is set
     */
    public static String readSetting(String envKey, String propKey) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
        }
        return value != null && !value.isEmpty() ? value.trim() : null;
    }

    /**
     * Read a positive integer setting, falling back on missing or invalid values.
     */
    public static int readIntSetting(String envKey, String propKey, int fallback) {
        String value = readSetting(envKey, propKey);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed > 0) {
                logger.info("Using {}={}", envKey, parsed);
                return parsed;
            }
            logger.warn("Non-positive {} value: {}, using default", envKey, value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default", envKey, value);
        }
        return fallback;
    }

    public String getBackendName() {
        return backendName;
    }

    public List<ServerEndpoint> getServers() {
        return servers;
    }

    @Override
    public String toString() {
        return "DpsConfig{" +
               "backend='" + backendName + '\'' +
               ", servers=" + servers +
               '}';
    }
}
