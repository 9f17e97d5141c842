package com.dpstore.network;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.network.protocol.BinaryProtocol;
import com.dpstore.network.protocol.Command;
import com.dpstore.network.protocol.ProtocolException;
import com.dpstore.network.protocol.Response;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Selector-side state of one client connection.
 *
 * The selector thread frames requests out of the read buffer and queues them.
 * Queued commands run on the worker pool strictly one after another, so replies
 * leave in request order even when the client pipelines.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private static final int INITIAL_BUFFER_SIZE = 64 * 1024;
    private static final int MAX_FRAME_SIZE = BinaryProtocol.REQUEST_HEADER_SIZE
            + 2 * BinaryProtocol.MAX_KEY_LENGTH + BinaryProtocol.MAX_VALUE_LENGTH;
    private static final int MAX_BACKLOG = 100;
    private static final long PARTIAL_FRAME_LIMIT_NANOS = TimeUnit.SECONDS.toNanos(30);

    private final SocketChannel channel;
    private final SelectionKey key;
    private final CommandExecutor executor;
    private final Executor workers;
    private final MetricsCollector metrics;
    private final String client;

    private ByteBuffer inbound = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);
    private long partialFrameSince = -1;

    // Guarded by this
    private final Deque<Command> backlog = new ArrayDeque<>();
    private final Deque<ByteBuffer> outbound = new ArrayDeque<>();
    private boolean running;
    private boolean closed;

    ConnectionHandler(SocketChannel channel, SelectionKey key, BackendAdapter engine, MetricsCollector metrics,
                      String authToken, Executor workers) {
        this.channel = channel;
        this.key = key;
        this.workers = workers;
        this.metrics = metrics;
        this.client = describe(channel);
        this.executor = new CommandExecutor(engine, metrics, authToken, client);
        metrics.connectionOpened();
    }

    private static String describe(SocketChannel channel) {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Read what the socket has and queue every complete request.
     *
     * @return false if the connection must be closed
     */
    boolean onReadable() {
        try {
            int read = channel.read(inbound);
            if (read < 0) {
                logger.debug("Client {} disconnected", client);
                return false;
            }
            inbound.flip();
            boolean framed = false;
            while (BinaryProtocol.hasCompleteRequest(inbound)) {
                if (!enqueue(BinaryProtocol.decodeCommand(inbound))) {
                    return false;
                }
                framed = true;
            }
            inbound.compact();
            return checkPartialFrame(framed);
        } catch (ProtocolException e) {
            logger.warn("Protocol violation from {}, closing: {}", client, e.getMessage());
            return false;
        } catch (IOException e) {
            logger.debug("Read from {} failed: {}", client, e.getMessage());
            return false;
        }
    }

    private boolean checkPartialFrame(boolean framed) {
        if (inbound.position() == 0) {
            partialFrameSince = -1;
            return true;
        }
        if (!inbound.hasRemaining()) {
            if (inbound.capacity() >= MAX_FRAME_SIZE) {
                throw new ProtocolException("Request from " + client + " exceeds " + MAX_FRAME_SIZE + " bytes");
            }
            ByteBuffer larger = ByteBuffer.allocate((int) Math.min(2L * inbound.capacity(), MAX_FRAME_SIZE));
            inbound.flip();
            inbound = larger.put(inbound);
        }
        long now = System.nanoTime();
        if (framed || partialFrameSince < 0) {
            partialFrameSince = now;
        } else if (now - partialFrameSince > PARTIAL_FRAME_LIMIT_NANOS) {
            logger.warn("Client {} left a request unfinished for too long, closing", client);
            return false;
        }
        return true;
    }

    private synchronized boolean enqueue(Command command) {
        if (backlog.size() >= MAX_BACKLOG) {
            logger.error("Client {} has more than {} requests queued, closing", client, MAX_BACKLOG);
            return false;
        }
        backlog.addLast(command);
        if (!running) {
            running = true;
            workers.execute(this::drainBacklog);
        }
        return true;
    }

    private void drainBacklog() {
        while (true) {
            Command next;
            synchronized (this) {
                next = backlog.pollFirst();
                if (next == null || closed) {
                    running = false;
                    return;
                }
            }
            reply(executor.execute(next));
        }
    }

    private synchronized void reply(Response response) {
        if (closed) {
            return;
        }
        boolean wasIdle = outbound.isEmpty();
        outbound.addLast(BinaryProtocol.encode(response));
        if (wasIdle && key.isValid()) {
            key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
            key.selector().wakeup();
        }
    }

    /**
     * Write queued replies.
     *
     * @return false if the connection must be closed
     */
    synchronized boolean onWritable() {
        try {
            if (!outbound.isEmpty()) {
                channel.write(outbound.toArray(new ByteBuffer[0]));
            }
            while (!outbound.isEmpty() && !outbound.peekFirst().hasRemaining()) {
                outbound.removeFirst();
            }
            if (outbound.isEmpty() && key.isValid()) {
                key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
            }
            return true;
        } catch (IOException e) {
            logger.debug("Write to {} failed: {}", client, e.getMessage());
            return false;
        }
    }

    /**
     * Close the connection. Idempotent.
     */
    void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            backlog.clear();
            outbound.clear();
        }
        key.cancel();
        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection to {}: {}", client, e.getMessage());
        }
        metrics.connectionClosed();
        logger.debug("Connection to {} closed", client);
    }

    String getClient() {
        return client;
    }
}
