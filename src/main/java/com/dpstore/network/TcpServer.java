package com.dpstore.network;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.config.DpsConfig;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NIO server exposing an engine over the dps-server wire protocol.
 *
 * One selector thread accepts clients and moves bytes; commands run on a
 * bounded worker pool. Sized by DPSTORE_WORKER_THREADS / dpstore.worker.threads.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    private static final int DEFAULT_WORKER_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());
    private static final long SELECT_TIMEOUT_MS = 1000;

    private final int requestedPort;
    private final BackendAdapter engine;
    private final MetricsCollector metrics;
    private final String authToken;
    private final ExecutorService workers;
    private final Set<ConnectionHandler> connections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean();

    private Selector selector;
    private ServerSocketChannel listener;
    private Thread loopThread;
    private volatile int boundPort;

    /**
     * Create a server whose auth token comes from DPSTORE_SERVER_TOKEN / dpstore.server.token.
     */
    public TcpServer(int port, BackendAdapter engine, MetricsCollector metrics) {
        this(port, engine, metrics, DpsConfig.readSetting("DPSTORE_SERVER_TOKEN", "dpstore.server.token"));
    }

    /**
     * @param port      port to listen on, 0 for an ephemeral port
     * @param authToken token clients must AUTH with, or null to accept everyone
     */
    public TcpServer(int port, BackendAdapter engine, MetricsCollector metrics, String authToken) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.requestedPort = port;
        this.boundPort = port;
        this.engine = engine;
        this.metrics = metrics;
        this.authToken = authToken != null && !authToken.isEmpty() ? authToken : null;
        this.workers = newWorkerPool(DpsConfig.readIntSetting("DPSTORE_WORKER_THREADS",
                "dpstore.worker.threads", DEFAULT_WORKER_THREADS));
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger sequence = new AtomicInteger();
        logger.debug("Starting {} worker threads", threads);
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(threads * 1000),
                task -> {
                    Thread thread = new Thread(task, "dpstore-worker-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Bind and run the selector loop on a background thread.
     *
     * @throws IOException if the port cannot be bound
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already running");
        }
        try {
            selector = Selector.open();
            listener = ServerSocketChannel.open();
            listener.configureBlocking(false);
            listener.socket().setReuseAddress(true);
            listener.bind(new InetSocketAddress(requestedPort));
            listener.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            running.set(false);
            releaseResources();
            throw e;
        }
        boundPort = listener.socket().getLocalPort();
        loopThread = new Thread(this::selectLoop, "dpstore-server-" + boundPort);
        loopThread.start();
        logger.info("Listening on port {} (auth {})", boundPort, authToken != null ? "required" : "disabled");
    }

    private void selectLoop() {
        try {
            while (running.get()) {
                if (selector.select(SELECT_TIMEOUT_MS) == 0) {
                    continue;
                }
                for (SelectionKey key : selector.selectedKeys()) {
                    handle(key);
                }
                selector.selectedKeys().clear();
            }
        } catch (IOException e) {
            if (running.get()) {
                logger.error("Selector failed, server stopping", e);
                running.set(false);
            }
        } finally {
            releaseResources();
        }
    }

    private void handle(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        try {
            if (!key.isValid()) {
                return;
            }
            if (key.isAcceptable()) {
                accept();
                return;
            }
            boolean keep = true;
            if (key.isReadable()) {
                keep = handler.onReadable();
            }
            if (keep && key.isValid() && key.isWritable()) {
                keep = handler.onWritable();
            }
            if (!keep) {
                drop(handler);
            }
        } catch (CancelledKeyException e) {
            logger.trace("Key of {} cancelled", handler != null ? handler.getClient() : "listener");
        } catch (IOException | RuntimeException e) {
            logger.error("Unexpected failure on {}", handler != null ? handler.getClient() : "listener", e);
            if (handler != null) {
                drop(handler);
            }
        }
    }

    private void accept() throws IOException {
        SocketChannel client = listener.accept();
        if (client == null) {
            return;
        }
        client.configureBlocking(false);
        client.socket().setTcpNoDelay(true);
        client.socket().setKeepAlive(true);
        SelectionKey key = client.register(selector, SelectionKey.OP_READ);
        ConnectionHandler handler = new ConnectionHandler(client, key, engine, metrics, authToken, workers);
        key.attach(handler);
        connections.add(handler);
        logger.debug("Accepted {}", handler.getClient());
    }

    private void drop(ConnectionHandler handler) {
        connections.remove(handler);
        handler.close();
    }

    /**
     * Stop accepting work and wait briefly for the selector loop to exit.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        logger.info("Stopping server on port {}", boundPort);
        if (selector != null) {
            selector.wakeup();
        }
        if (loopThread != null && loopThread != Thread.currentThread()) {
            try {
                loopThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void releaseResources() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        connections.forEach(ConnectionHandler::close);
        connections.clear();
        closeQuietly(listener);
        closeQuietly(selector);
        logger.info("Server on port {} stopped", boundPort);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            logger.debug("Error closing {}: {}", resource, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Port the server listens on; after {@link #start()} this is the bound port.
     */
    public int getPort() {
        return boundPort;
    }
}
