package com.dpstore.network;

import com.dpstore.backend.BackendAdapter;
import com.dpstore.network.protocol.Command;
import com.dpstore.network.protocol.Response;
import com.dpstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs decoded commands against the engine for one client session.
 *
 * Holds the session's AUTH state. Engine exceptions become ERROR replies:
 * argument errors are prefixed with {@code "Invalid argument: "}, type and
 * counter errors keep the engine's message, anything else is an internal error.
 */
class CommandExecutor {

    private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

    static final String AUTH_REQUIRED = "AUTH required";
    static final String INVALID_ARGUMENT = "Invalid argument: ";

    private final BackendAdapter engine;
    private final MetricsCollector metrics;
    private final byte[] token;
    private final String client;
    private volatile boolean authenticated;

    /**
     * @param authToken token the session must present, or null for an open server
     * @param client    client address, used in log messages
     */
    CommandExecutor(BackendAdapter engine, MetricsCollector metrics, String authToken, String client) {
        this.engine = engine;
        this.metrics = metrics;
        this.token = authToken != null ? authToken.getBytes(StandardCharsets.UTF_8) : null;
        this.client = client;
        this.authenticated = token == null;
    }

    Response execute(Command command) {
        if (command.getType() == Command.AUTH) {
            return authenticate(command.getValueUnsafe());
        }
        if (!authenticated) {
            metrics.recordError("AUTH_REQUIRED");
            return Response.error(AUTH_REQUIRED);
        }

        long start = System.nanoTime();
        try {
            Response response = dispatch(command);
            metrics.recordOperation(command.getTypeName().toLowerCase(Locale.ROOT), System.nanoTime() - start);
            return response;
        } catch (IllegalArgumentException e) {
            logger.debug("{} from {} rejected: {}", command.getTypeName(), client, e.getMessage());
            metrics.recordError("INVALID_ARGUMENT");
            return Response.error(INVALID_ARGUMENT + e.getMessage());
        } catch (IllegalStateException | UnsupportedOperationException e) {
            logger.debug("{} from {} failed: {}", command.getTypeName(), client, e.getMessage());
            metrics.recordError("REJECTED");
            return Response.error(e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Engine failure on {} from {}", command.getTypeName(), client, e);
            metrics.recordError("INTERNAL");
            return Response.error("Internal error: " + e.getMessage());
        }
    }

    private Response dispatch(Command command) throws IOException {
        switch (command.getType()) {
            case Command.PING:
                return Response.pong();
            case Command.GET:
                return found(engine.read(key(command)));
            case Command.SET:
                engine.write(key(command), value(command), command.getTtlSeconds());
                return Response.ok();
            case Command.SETNX:
                return Response.bool(engine.writeIfAbsent(key(command), value(command), command.getTtlSeconds()));
            case Command.DELETE:
                return Response.bool(engine.delete(key(command)));
            case Command.INCR:
                return Response.ok(engine.increment(key(command)));
            case Command.HSET:
                engine.setField(key(command), field(command), value(command));
                return Response.ok();
            case Command.HGET:
                return found(engine.getField(key(command), field(command)));
            case Command.HEXISTS:
                return Response.bool(engine.fieldExists(key(command), field(command)));
            case Command.HDEL:
                return Response.ok(engine.deleteField(key(command), field(command)));
            case Command.HLEN:
                return Response.ok(engine.fieldCount(key(command)));
            case Command.HKEYS:
                return Response.ok(engine.fieldNames(key(command)));
            default:
                logger.warn("Unknown command type {} from {}", command.getType(), client);
                metrics.recordError("UNKNOWN_COMMAND");
                return Response.error("Unknown command");
        }
    }

    private Response authenticate(byte[] presented) {
        if (token == null) {
            authenticated = true;
            return Response.ok();
        }
        if (presented == null || presented.length == 0) {
            return Response.error("AUTH requires token");
        }
        if (!MessageDigest.isEqual(presented, token)) {
            logger.warn("Authentication failed for {}", client);
            metrics.recordError("AUTH_FAILED");
            return Response.error("Authentication failed");
        }
        authenticated = true;
        return Response.ok();
    }

    boolean isAuthenticated() {
        return authenticated;
    }

    private static Response found(Optional<byte[]> value) {
        return value.map(Response::ok).orElseGet(Response::notFound);
    }

    private static String key(Command command) {
        if (command.getKey() == null) {
            throw new IllegalArgumentException("Key required for " + command.getTypeName());
        }
        return command.getKey();
    }

    private static String field(Command command) {
        if (command.getField() == null) {
            throw new IllegalArgumentException("Field required for " + command.getTypeName());
        }
        return command.getField();
    }

    private static byte[] value(Command command) {
        byte[] value = command.getValueUnsafe();
        return value != null ? value : new byte[0];
    }
}
