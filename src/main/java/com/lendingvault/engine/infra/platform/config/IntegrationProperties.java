package com.lendingvault.engine.infra.platform.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "vault.integration")
public class IntegrationProperties {

    /** Lending platform name → REST base url. */
    private Map<String, String> platforms = new LinkedHashMap<>();

    private String custodyBaseUrl = "http://localhost:8090";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(10);
}
