package com.dpstore.backend;

import com.dpstore.config.ServerEndpoint;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Contract every storage engine satisfies.
 *
 * Keys are flat strings. A key holds either a plain value or a container of
 * named fields; using a plain-value operation on a container key, or the
 * reverse, is an error. Implementations must be thread-safe. Transport and
 * availability failures are reported as {@link IOException}.
 */
public interface BackendAdapter extends AutoCloseable {

    /**
     * Product name of this backend, as used in the configuration file.
     */
    String getName();

    /**
     * Connect to the backend servers.
     *
     * @param servers the configured server entries (may be empty for in-process engines)
     * @throws IOException if no connection can be established
     */
    void connect(List<ServerEndpoint> servers) throws IOException;

    /**
     * Drop and re-establish connections to the last server list.
     *
     * @throws IOException if the connection cannot be re-established
     */
    void reconnect() throws IOException;

    /**
     * Check if the backend is reachable.
     */
    boolean isConnected();

    /**
     * Atomically write a plain value only if the key does not exist.
     *
     * @param key        the key
     * @param value      the value
     * @param ttlSeconds expiry in seconds, 0 for none
     * @return true if this call created the key
     * @throws IOException if the backend cannot be reached
     */
    boolean writeIfAbsent(String key, byte[] value, int ttlSeconds) throws IOException;

    /**
     * Read a plain value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     * @throws IOException if the backend cannot be reached
     */
    Optional<byte[]> read(String key) throws IOException;

    /**
     * Write a plain value, replacing any previous value.
     *
     * @param key        the key
     * @param value      the value
     * @param ttlSeconds expiry in seconds, 0 for none
     * @throws IOException if the backend cannot be reached
     */
    void write(String key, byte[] value, int ttlSeconds) throws IOException;

    /**
     * Delete a key of either kind.
     *
     * @param key the key
     * @return true if the key existed
     * @throws IOException if the backend cannot be reached
     */
    boolean delete(String key) throws IOException;

    /**
     * Atomically increment a counter, creating it at 0 first if absent.
     *
     * @param counterKey the counter key
     * @return the value after incrementing
     * @throws IOException if the backend cannot be reached
     */
    long increment(String counterKey) throws IOException;

    /**
     * Set a field in a container, creating the container if absent.
     *
     * @throws IOException if the backend cannot be reached
     */
    void setField(String containerKey, String field, byte[] value) throws IOException;

    /**
     * Read a field from a container.
     *
     * @return the field value, or empty if the container or field is absent
     * @throws IOException if the backend cannot be reached
     */
    Optional<byte[]> getField(String containerKey, String field) throws IOException;

    /**
     * Check if a container field exists.
     *
     * @throws IOException if the backend cannot be reached
     */
    boolean fieldExists(String containerKey, String field) throws IOException;

    /**
     * Delete a field from a container.
     *
     * @return number of fields removed (0 or 1)
     * @throws IOException if the backend cannot be reached
     */
    long deleteField(String containerKey, String field) throws IOException;

    /**
     * Count the fields in a container.
     *
     * @return field count, 0 if the container is absent
     * @throws IOException if the backend cannot be reached
     */
    long fieldCount(String containerKey) throws IOException;

    /**
     * List the field names of a container, in backend order.
     *
     * @return field names, empty if the container is absent
     * @throws IOException if the backend cannot be reached
     */
    List<String> fieldNames(String containerKey) throws IOException;

    /**
     * Run a backend-specific command.
     *
     * @param command the command text
     * @return the backend's reply
     * @throws UnsupportedOperationException if the command has no meaning for this backend
     * @throws IOException                   if the backend cannot be reached
     */
    String runCommand(String command) throws IOException;

    /**
     * Release connections and background resources.
     */
    @Override
    void close();
}
