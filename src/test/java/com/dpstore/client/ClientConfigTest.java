package com.dpstore.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClientConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("dpstore.client.max.retries");
        System.clearProperty("dpstore.client.read.timeout.ms");
    }

    @Test
    void builder_defaultValues() {
        ClientConfig config = ClientConfig.defaults();

        assertThat(config.getReadTimeoutMs()).isEqualTo(30000);
        assertThat(config.getMaxConnectionsPerServer()).isEqualTo(10);
        assertThat(config.isRetryOnFailure()).isTrue();
        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.getRetryDelayMs()).isEqualTo(100);
        assertThat(config.attemptsPerRequest()).isEqualTo(3);
    }

    @Test
    void builder_customValues() {
        ClientConfig config = ClientConfig.builder()
            .readTimeoutMs(15000)
            .maxConnectionsPerServer(20)
            .maxRetries(5)
            .retryDelayMs(250)
            .retryOnFailure(false)
            .build();

        assertThat(config.getReadTimeoutMs()).isEqualTo(15000);
        assertThat(config.getMaxConnectionsPerServer()).isEqualTo(20);
        assertThat(config.getMaxRetries()).isEqualTo(5);
        assertThat(config.getRetryDelayMs()).isEqualTo(250);
        assertThat(config.attemptsPerRequest()).isEqualTo(1);
    }

    @Test
    void attemptsPerRequest_zeroRetriesStillSendsOnce() {
        assertThat(ClientConfig.builder().maxRetries(0).build().attemptsPerRequest()).isEqualTo(1);
    }

    @Test
    void builder_invalidValues_throw() {
        assertThatThrownBy(() -> ClientConfig.builder().readTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder().maxConnectionsPerServer(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder().maxRetries(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder().retryDelayMs(-5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromEnvironment_readsProperties() {
        System.setProperty("dpstore.client.max.retries", "7");
        System.setProperty("dpstore.client.read.timeout.ms", "bogus");

        ClientConfig config = ClientConfig.fromEnvironment();

        assertThat(config.getMaxRetries()).isEqualTo(7);
        assertThat(config.getReadTimeoutMs()).isEqualTo(ClientConfig.DEFAULT_READ_TIMEOUT_MS);
    }

    @Test
    void toString_listsSettings() {
        assertThat(ClientConfig.builder().maxRetries(7).build().toString()).contains("maxRetries=7");
    }
}
