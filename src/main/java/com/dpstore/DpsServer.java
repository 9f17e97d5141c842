package com.dpstore;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.config.DpsConfig;
import com.dpstore.network.TcpServer;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.CountDownLatch;

/**
 * DPStore backend server entry point.
 * Serves an in-memory engine over the DPStore wire protocol so that processes on
 * several machines can share stores and locks through the dps-server backend.
 */
public class DpsServer {

    private static final Logger logger = LoggerFactory.getLogger(DpsServer.class);

    public static final int DEFAULT_PORT = 9001;
    static final String VERSION = "1.0.0";

    private final InMemoryBackend engine;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Create a server whose token comes from DPSTORE_SERVER_TOKEN / dpstore.server.token.
     *
     * @param port the port to listen on, 0 for an ephemeral port
     */
    public DpsServer(int port) {
        this(port, DpsConfig.readSetting("DPSTORE_SERVER_TOKEN", "dpstore.server.token"));
    }

    /**
     * @param port      the port to listen on, 0 for an ephemeral port
     * @param authToken the token clients must AUTH with, or null to accept every client
     */
    public DpsServer(int port, String authToken) {
        this.engine = new InMemoryBackend();
        this.metrics = new MetricsCollector();
        this.tcpServer = new TcpServer(port, engine, metrics, authToken);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting DPStore Server v{}", VERSION);
        tcpServer.start();
        logger.info("DPStore Server listening on port {}", tcpServer.getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "dpstore-shutdown"));
        start();
        stopped.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        logger.info("Stopping DPStore Server");
        tcpServer.stop();
        engine.close();
        stopped.countDown();
        logger.info("DPStore Server stopped ({})", metrics.summary());
    }

    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the bound port.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    public InMemoryBackend getEngine() {
        return engine;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Command line entry point: {@code dpstore-server [--port N] [--token T]}.
     */
    public static void main(String[] args) {
        int port = DEFAULT_PORT;
        String token = null;

        Iterator<String> options = Arrays.asList(args).iterator();
        while (options.hasNext()) {
            String option = options.next();
            if (option.equals("-p") || option.equals("--port")) {
                try {
                    port = parsePort(requireValue(option, options));
                } catch (IllegalArgumentException e) {
                    fail(e.getMessage());
                }
            } else if (option.equals("--token")) {
                token = requireValue(option, options);
            } else if (option.equals("-h") || option.equals("--help")) {
                System.out.println(usage());
                return;
            } else if (option.equals("-v") || option.equals("--version")) {
                System.out.println("dpstore-server " + VERSION);
                return;
            } else {
                fail("Unknown option: " + option);
            }
        }

        DpsServer server = token != null ? new DpsServer(port, token) : new DpsServer(port);
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Could not start on port {}: {}", port, e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String option, Iterator<String> options) {
        if (!options.hasNext()) {
            fail(option + " needs a value");
        }
        return options.next();
    }

    static int parsePort(String text) {
        int port;
        try {
            port = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a port number: " + text, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range 1-65535: " + port);
        }
        return port;
    }

    private static void fail(String message) {
        System.err.println(message);
        System.err.println(usage());
        System.exit(2);
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "usage: dpstore-server [-p|--port <port>] [--token <token>] [-h|--help] [-v|--version]",
                "",
                "Serves shared stores and locks to dps-server backend clients (default port " + DEFAULT_PORT + ").",
                "The token may also come from DPSTORE_SERVER_TOKEN. Clients put it in",
                "the password field of their server entry, e.g. host:9001:<token>.");
    }
}
