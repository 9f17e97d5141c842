package com.dpstore.network;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.network.protocol.Command;
import com.dpstore.network.protocol.Response;
import com.dpstore.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class CommandExecutorTest {

    private InMemoryBackend engine;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        engine = new InMemoryBackend();
        metrics = new MetricsCollector();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void openServer_acceptsCommandsWithoutAuth() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, null, "test");

        assertThat(executor.isAuthenticated()).isTrue();
        assertThat(executor.execute(Command.set("k", bytes("v"), 0)).isOk()).isTrue();
        assertThat(executor.execute(Command.get("k")).getValue()).isEqualTo(bytes("v"));
        assertThat(metrics.getOperationCount("set")).isEqualTo(1);
        assertThat(metrics.getOperationCount("get")).isEqualTo(1);
    }

    @Test
    void securedServer_rejectsUntilAuthenticated() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, "s3cret", "test");

        Response denied = executor.execute(Command.ping());
        assertThat(denied.isError()).isTrue();
        assertThat(denied.getErrorMessage()).isEqualTo(CommandExecutor.AUTH_REQUIRED);

        assertThat(executor.execute(Command.auth("wrong")).getErrorMessage()).isEqualTo("Authentication failed");
        assertThat(executor.isAuthenticated()).isFalse();

        assertThat(executor.execute(Command.auth("s3cret")).isOk()).isTrue();
        assertThat(executor.execute(Command.ping()).getStatus()).isEqualTo(Response.PONG);
    }

    @Test
    void auth_withoutToken_isRejected() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, "s3cret", "test");

        assertThat(executor.execute(Command.auth(null)).getErrorMessage()).isEqualTo("AUTH requires token");
    }

    @Test
    void containerCommands_mapToEngine() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, null, "test");

        executor.execute(Command.setField("c", "a", bytes("1")));
        executor.execute(Command.setField("c", "b", bytes("2")));

        assertThat(executor.execute(Command.fieldCount("c")).getNumber()).isEqualTo(2);
        assertThat(executor.execute(Command.fieldExists("c", "a")).getStatus()).isEqualTo(Response.TRUE);
        assertThat(executor.execute(Command.fieldNames("c")).getNames()).containsExactlyInAnyOrder("a", "b");
        assertThat(executor.execute(Command.deleteField("c", "a")).getNumber()).isEqualTo(1);
        assertThat(executor.execute(Command.getField("c", "a")).getStatus()).isEqualTo(Response.NOT_FOUND);
    }

    @Test
    void missingKey_isInvalidArgument() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, null, "test");

        Response response = executor.execute(new Command(Command.GET, null, null));

        assertThat(response.getErrorMessage()).startsWith(CommandExecutor.INVALID_ARGUMENT);
        assertThat(metrics.getErrorCount("INVALID_ARGUMENT")).isEqualTo(1);
    }

    @Test
    void wrongType_keepsEngineMessage() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, null, "test");
        executor.execute(Command.set("plain", bytes("x"), 0));

        Response response = executor.execute(Command.increment("plain"));

        assertThat(response.getErrorMessage()).isEqualTo("Value at plain is not an integer");
    }

    @Test
    void unknownType_isReported() {
        CommandExecutor executor = new CommandExecutor(engine, metrics, null, "test");

        Response response = executor.execute(new Command((byte) 0x7F, "k", null));

        assertThat(response.getErrorMessage()).isEqualTo("Unknown command");
    }
}
