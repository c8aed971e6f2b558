package com.lendingvault.engine.infra.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import com.lendingvault.engine.infra.platform.client.HttpReceivableAdapter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class ReceivableAdapterConfig {

    @Bean
    public ReceivableAdapters receivableAdapters(IntegrationProperties properties, OkHttpClient okHttpClient,
                                                 ObjectMapper objectMapper, Clock clock) {
        List<HttpReceivableAdapter> adapters = properties.getPlatforms().entrySet().stream()
                .map(entry -> new HttpReceivableAdapter(entry.getKey(), entry.getValue(),
                        okHttpClient, objectMapper, clock))
                .toList();
        log.info("[Platform] receivable adapters configured: {}", properties.getPlatforms().keySet());
        return new ReceivableAdapters(adapters);
    }
}
