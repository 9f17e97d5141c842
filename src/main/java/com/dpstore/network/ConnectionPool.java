package com.dpstore.network;

import com.dpstore.config.ServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Client-side pool of {@link ServerConnection}s, bounded per server entry.
 *
 * The connect timeout of each server comes from its entry and also bounds the
 * wait for a free slot. Idle connections are reused most-recent first.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final int maxPerServer;
    private final int readTimeoutMs;
    private final ConcurrentMap<ServerEndpoint, Slots> slots = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * @param maxPerServer  maximum open connections per server
     * @param readTimeoutMs limit for waiting on one reply
     */
    public ConnectionPool(int maxPerServer, int readTimeoutMs) {
        if (maxPerServer <= 0) {
            throw new IllegalArgumentException("maxPerServer must be positive, got: " + maxPerServer);
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("readTimeoutMs must be positive, got: " + readTimeoutMs);
        }
        this.maxPerServer = maxPerServer;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Take a connection to a server, opening one if none is idle.
     *
     * @throws IOException if the pool is closed, every slot stays busy, or the connect fails
     */
    public ServerConnection borrow(ServerEndpoint endpoint) throws IOException {
        if (closed) {
            throw new IOException("Connection pool is closed");
        }
        return slots.computeIfAbsent(endpoint, Slots::new).borrow();
    }

    /**
     * Hand back a connection after a completed exchange.
     */
    public void giveBack(ServerConnection connection) {
        Slots owner = slots.get(connection.getEndpoint());
        if (owner == null || closed) {
            connection.closeQuietly();
            return;
        }
        owner.giveBack(connection);
    }

    /**
     * Close a connection whose stream state is unknown and free its slot.
     */
    public void discard(ServerConnection connection) {
        Slots owner = slots.get(connection.getEndpoint());
        if (owner == null) {
            connection.closeQuietly();
            return;
        }
        owner.discard(connection);
    }

    public int getOpenConnections() {
        return slots.values().stream().mapToInt(s -> s.open.size()).sum();
    }

    public int getIdleConnections() {
        return slots.values().stream().mapToInt(s -> s.idle.size()).sum();
    }

    @Override
    public void close() {
        closed = true;
        slots.values().forEach(Slots::closeAll);
        slots.clear();
        logger.debug("Connection pool closed");
    }

    private final class Slots {
        private final ServerEndpoint endpoint;
        private final Semaphore permits = new Semaphore(maxPerServer);
        private final BlockingDeque<ServerConnection> idle = new LinkedBlockingDeque<>();
        private final Set<ServerConnection> open = ConcurrentHashMap.newKeySet();

        Slots(ServerEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        ServerConnection borrow() throws IOException {
            ServerConnection reused;
            while ((reused = idle.pollFirst()) != null) {
                if (reused.isUsable()) {
                    return reused;
                }
                discard(reused);
            }

            int waitMs = (int) TimeUnit.SECONDS.toMillis(endpoint.getTimeoutSeconds());
            try {
                if (!permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS)) {
                    throw new IOException("All " + maxPerServer + " connections to "
                            + endpoint.getAddress() + " are busy");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted waiting for a connection to " + endpoint.getAddress(), e);
            }

            ServerConnection fresh;
            try {
                fresh = ServerConnection.open(endpoint, waitMs, readTimeoutMs);
            } catch (IOException e) {
                permits.release();
                throw e;
            }
            open.add(fresh);
            return fresh;
        }

        void giveBack(ServerConnection connection) {
            if (connection.isUsable() && open.contains(connection)) {
                idle.offerFirst(connection);
            } else {
                discard(connection);
            }
        }

        void discard(ServerConnection connection) {
            connection.closeQuietly();
            idle.remove(connection);
            if (open.remove(connection)) {
                permits.release();
            }
        }

        void closeAll() {
            open.forEach(ServerConnection::closeQuietly);
            open.clear();
            idle.clear();
        }
    }
}
