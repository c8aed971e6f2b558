package com.lendingvault.engine.infra.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static com.lendingvault.engine.support.VaultAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class ReceivableAdapterConfigTest {

    @Test
    void oneAdapterPerConfiguredPlatform() {
        IntegrationProperties properties = new IntegrationProperties();
        properties.getPlatforms().put("demo", "http://localhost:8091/api");
        properties.getPlatforms().put("other", "http://localhost:8092/api");

        ReceivableAdapters adapters = new ReceivableAdapterConfig().receivableAdapters(
                properties, new OkHttpClient(), new ObjectMapper(), Clock.systemUTC());

        assertThat(adapters.platforms()).containsExactly("demo", "other");
        assertThat(adapters.forPlatform("other").platform()).isEqualTo("other");
        assertRejected(() -> adapters.forPlatform("unknown"), VaultErrorCode.UNSUPPORTED_NOTE_TOKEN);
    }
}
