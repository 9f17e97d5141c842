package com.dpstore.backend.remote;

import com.dpstore.backend.AuthenticationException;
import com.dpstore.backend.BackendAdapter;
import com.dpstore.client.ClientConfig;
import com.dpstore.config.ServerEndpoint;
import com.dpstore.network.ConnectionPool;
import com.dpstore.network.ServerConnection;
import com.dpstore.network.protocol.Command;
import com.dpstore.network.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Backend adapter talking to one or more DpsServer processes.
 *
 * Each backend key lives on exactly one server, chosen by a stable hash of the
 * key over the configured server list, so every process with the same config
 * agrees on placement. A store's container is a single key and therefore never
 * spans servers.
 */
public class RemoteBackend implements BackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RemoteBackend.class);

    public static final String NAME = "dps-server";
    static final String AUTH_REQUIRED = "AUTH required";
    private static final String INVALID_ARGUMENT_PREFIX = "Invalid argument: ";

    private final ClientConfig config;
    private volatile ConnectionPool connectionPool;
    private volatile List<ServerEndpoint> servers;
    private volatile boolean connected;
    private volatile boolean closed;

    public RemoteBackend() {
        this(ClientConfig.fromEnvironment());
    }

    public RemoteBackend(ClientConfig config) {
        this.config = config;
        this.servers = Collections.emptyList();
        this.connectionPool = newPool();
    }

    private ConnectionPool newPool() {
        return new ConnectionPool(config.getMaxConnectionsPerServer(), config.getReadTimeoutMs());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public synchronized void connect(List<ServerEndpoint> servers) throws IOException {
        ensureOpen();
        if (servers == null || servers.isEmpty()) {
            throw new IOException("No servers configured for the " + NAME + " backend");
        }
        for (ServerEndpoint server : servers) {
            if (server.isUseTls()) {
                throw new IOException("TLS is not supported by the " + NAME + " backend: " + server.getAddress());
            }
        }
        this.servers = Collections.unmodifiableList(new ArrayList<>(servers));
        connected = false;
        for (ServerEndpoint server : this.servers) {
            Response response = executeOnServer(Command.ping(), server);
            if (response.isError() && AUTH_REQUIRED.equals(response.getErrorMessage())) {
                throw new AuthenticationException("Server " + server.getAddress() + " requires a password");
            }
            if (response.getStatus() != Response.PONG) {
                throw new IOException("Unexpected PING reply from " + server.getAddress() + ": " + response);
            }
        }
        connected = true;
        logger.info("Connected to {} server(s): {}", this.servers.size(), this.servers);
    }

    @Override
    public synchronized void reconnect() throws IOException {
        ensureOpen();
        logger.info("Reconnecting to {} server(s)", servers.size());
        connectionPool.close();
        connectionPool = newPool();
        connect(servers);
    }

    /**
     * Check that every server answers PING.
     */
    @Override
    public boolean isConnected() {
        if (!connected || closed) {
            return false;
        }
        for (ServerEndpoint server : servers) {
            try {
                if (executeOnServer(Command.ping(), server).getStatus() != Response.PONG) {
                    return false;
                }
            } catch (IOException e) {
                logger.debug("Health check failed for {}: {}", server.getAddress(), e.getMessage());
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean writeIfAbsent(String key, byte[] value, int ttlSeconds) throws IOException {
        return expectBool(execute(Command.setIfAbsent(key, value, ttlSeconds)));
    }

    @Override
    public Optional<byte[]> read(String key) throws IOException {
        return expectValue(execute(Command.get(key)));
    }

    @Override
    public void write(String key, byte[] value, int ttlSeconds) throws IOException {
        expectOk(execute(Command.set(key, value, ttlSeconds)));
    }

    @Override
    public boolean delete(String key) throws IOException {
        return expectBool(execute(Command.delete(key)));
    }

    @Override
    public long increment(String counterKey) throws IOException {
        return expectOk(execute(Command.increment(counterKey))).getNumber();
    }

    @Override
    public void setField(String containerKey, String field, byte[] value) throws IOException {
        expectOk(execute(Command.setField(containerKey, field, value)));
    }

    @Override
    public Optional<byte[]> getField(String containerKey, String field) throws IOException {
        return expectValue(execute(Command.getField(containerKey, field)));
    }

    @Override
    public boolean fieldExists(String containerKey, String field) throws IOException {
        return expectBool(execute(Command.fieldExists(containerKey, field)));
    }

    @Override
    public long deleteField(String containerKey, String field) throws IOException {
        return expectOk(execute(Command.deleteField(containerKey, field))).getNumber();
    }

    @Override
    public long fieldCount(String containerKey) throws IOException {
        return expectOk(execute(Command.fieldCount(containerKey))).getNumber();
    }

    @Override
    public List<String> fieldNames(String containerKey) throws IOException {
        return expectOk(execute(Command.fieldNames(containerKey))).getNames();
    }

    @Override
    public String runCommand(String command) throws IOException {
        if (command != null && "PING".equalsIgnoreCase(command.trim())) {
            for (ServerEndpoint server : requireServers()) {
                Response response = executeOnServer(Command.ping(), server);
                if (response.getStatus() != Response.PONG) {
                    throw new IOException("Unexpected PING reply from " + server.getAddress());
                }
            }
            return "PONG";
        }
        throw new UnsupportedOperationException("Command not supported by the " + NAME + " backend: " + command);
    }

    /**
     * Pick the server owning a key.
     * Package-private for testing.
     */
    ServerEndpoint serverFor(String key) {
        List<ServerEndpoint> current = requireServers();
        if (current.size() == 1) {
            return current.get(0);
        }
        CRC32 crc = new CRC32();
        crc.update(key.getBytes(StandardCharsets.UTF_8));
        return current.get((int) (crc.getValue() % current.size()));
    }

    private List<ServerEndpoint> requireServers() {
        List<ServerEndpoint> current = servers;
        if (current.isEmpty()) {
            throw new IllegalStateException("Backend is not connected");
        }
        return current;
    }

    /**
     * Execute a keyed command, retrying transport failures.
     * SETNX and INCR are not idempotent, so they are only retried when the
     * request never reached the server.
     */
    private Response execute(Command command) throws IOException {
        ensureOpen();
        if (command.getKey() == null || command.getKey().isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        ServerEndpoint server = serverFor(command.getKey());
        boolean idempotent = command.getType() != Command.SETNX && command.getType() != Command.INCR;
        int attempts = config.attemptsPerRequest();
        IOException lastException = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            RequestState state = new RequestState();
            try {
                return executeOnServer(command, server, state);
            } catch (IOException e) {
                lastException = e;
                logger.warn("Request {} to {} failed (attempt {}/{}): {}",
                        command.getTypeName(), server.getAddress(), attempt + 1, attempts, e.getMessage());
                if (state.sent && !idempotent) {
                    break;
                }
                if (attempt < attempts - 1) {
                    try {
                        Thread.sleep(config.getRetryDelayMs() * (attempt + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IOException("Interrupted during retry", ie);
                    }
                }
            }
        }
        throw new IOException("Request " + command.getTypeName() + " to " + server.getAddress()
                + " failed: " + lastException.getMessage(), lastException);
    }

    private Response executeOnServer(Command command, ServerEndpoint server) throws IOException {
        return executeOnServer(command, server, new RequestState());
    }

    private Response executeOnServer(Command command, ServerEndpoint server, RequestState state) throws IOException {
        ConnectionPool pool = connectionPool;
        ServerConnection conn = pool.borrow(server);
        boolean reusable = false;
        try {
            if (server.hasPassword() && !conn.isAuthenticated()) {
                Response auth = conn.exchange(Command.auth(server.getPassword()));
                if (auth.isError()) {
                    throw new AuthenticationException("Authentication with " + server.getAddress() + " failed: "
                            + auth.getErrorMessage());
                }
                conn.markAuthenticated();
            }
            state.sent = true;
            Response response = conn.exchange(command);
            reusable = true;
            return response;
        } finally {
            if (reusable) {
                pool.giveBack(conn);
            } else {
                pool.discard(conn);
            }
        }
    }

    private static Response expectOk(Response response) throws IOException {
        checkError(response);
        if (response.getStatus() != Response.OK) {
            throw new IOException("Unexpected reply: " + response);
        }
        return response;
    }

    private static boolean expectBool(Response response) throws IOException {
        checkError(response);
        if (response.getStatus() == Response.TRUE) {
            return true;
        }
        if (response.getStatus() == Response.FALSE) {
            return false;
        }
        throw new IOException("Unexpected reply: " + response);
    }

    private static Optional<byte[]> expectValue(Response response) throws IOException {
        if (response.isNotFound()) {
            return Optional.empty();
        }
        Response ok = expectOk(response);
        return Optional.of(ok.hasValue() ? ok.getValueUnsafe() : new byte[0]);
    }

    /**
     * Rethrow a server-side ERROR reply. Type mismatches and bad arguments keep
     * the exception types the in-process engine throws; anything else is reported
     * as an I/O failure.
     */
    private static void checkError(Response response) throws IOException {
        if (!response.isError()) {
            return;
        }
        String message = response.getErrorMessage() != null ? response.getErrorMessage() : "unknown error";
        if (message.startsWith("WRONGTYPE") || message.contains("is not an integer")) {
            throw new IllegalStateException(message);
        }
        if (message.startsWith(INVALID_ARGUMENT_PREFIX)) {
            throw new IllegalArgumentException(message.substring(INVALID_ARGUMENT_PREFIX.length()));
        }
        throw new IOException("Server error: " + message);
    }

    public List<ServerEndpoint> getServers() {
        return servers;
    }

    public int getConnectionCount() {
        return connectionPool.getOpenConnections();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Backend is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;
        connectionPool.close();
        logger.info("{} backend closed", NAME);
    }

    private static final class RequestState {
        boolean sent;
    }
}
