package com.dpstore.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

class DpsConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("dpstore.config.file");
        System.clearProperty("dpstore.backend");
        System.clearProperty("dpstore.test.int");
    }

    @Test
    void parse_skipsCommentsAndBlankLines() {
        DpsConfig config = DpsConfig.parse(Arrays.asList(
            "# servers for the nightly run",
            "",
            "dps-server",
            "   ",
            "# primary",
            "host1:9001",
            "host2"));

        assertThat(config.getBackendName()).isEqualTo("dps-server");
        assertThat(config.getServers()).containsExactly(
            ServerEndpoint.of("host1", 9001),
            ServerEndpoint.of("host2", DpsConfig.DEFAULT_PORT));
    }

    @Test
    void parse_backendOnly_hasNoServers() {
        DpsConfig config = DpsConfig.parse(Collections.singletonList("memory"));

        assertThat(config.getBackendName()).isEqualTo("memory");
        assertThat(config.getServers()).isEmpty();
    }

    @Test
    void parse_noBackendLine_throws() {
        assertThatThrownBy(() -> DpsConfig.parse(Arrays.asList("# only a comment", "")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_malformedServer_throws() {
        assertThatThrownBy(() -> DpsConfig.parse(Arrays.asList("dps-server", "host:notaport")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_readsFile() throws Exception {
        Path path = Path.of(getClass().getResource("/dps-test.cfg").toURI());

        DpsConfig config = DpsConfig.load(path);

        assertThat(config.getBackendName()).isEqualTo("dps-server");
        assertThat(config.getServers()).hasSize(3);
        assertThat(config.getServers().get(1).getPassword()).isEqualTo("s3cret");
        assertThat(config.getServers().get(1).getTimeoutSeconds()).isEqualTo(5);
        assertThat(config.getServers().get(2).getPort()).isEqualTo(DpsConfig.DEFAULT_PORT);
    }

    @Test
    void load_withoutFile_defaultsToMemory() throws Exception {
        DpsConfig config = DpsConfig.load();

        assertThat(config.getBackendName()).isEqualTo(DpsConfig.DEFAULT_BACKEND);
    }

    @Test
    void load_fileFromSystemProperty_withBackendOverride() throws Exception {
        Path path = Path.of(getClass().getResource("/dps-test.cfg").toURI());
        System.setProperty("dpstore.config.file", path.toString());
        System.setProperty("dpstore.backend", "memory");

        DpsConfig config = DpsConfig.load();

        assertThat(config.getBackendName()).isEqualTo("memory");
        assertThat(config.getServers()).hasSize(3);
    }

    @Test
    void readIntSetting_invalidValue_usesFallback() {
        System.setProperty("dpstore.test.int", "abc");
        assertThat(DpsConfig.readIntSetting("DPSTORE_TEST_INT", "dpstore.test.int", 7)).isEqualTo(7);

        System.setProperty("dpstore.test.int", "-2");
        assertThat(DpsConfig.readIntSetting("DPSTORE_TEST_INT", "dpstore.test.int", 7)).isEqualTo(7);

        System.setProperty("dpstore.test.int", "12");
        assertThat(DpsConfig.readIntSetting("DPSTORE_TEST_INT", "dpstore.test.int", 7)).isEqualTo(12);
    }

    @Test
    void backendName_isNormalized() {
        assertThat(DpsConfig.of("  DPS-Server ").getBackendName()).isEqualTo("dps-server");
    }
}
