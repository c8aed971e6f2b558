package com.lendingvault.engine.infra.custody;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.AssetTransfer;
import com.lendingvault.engine.domain.gateway.CollateralCustody;
import com.lendingvault.engine.domain.gateway.NoteCustody;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.infra.platform.config.IntegrationProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Custody service client moving the deposit asset, promissory notes and collateral.
 * Every call moves everything or throws.
 */
@Slf4j
@Component
public class HttpCustodyClient implements AssetTransfer, NoteCustody, CollateralCustody {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;

    public HttpCustodyClient(OkHttpClient okHttpClient, ObjectMapper objectMapper, IntegrationProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(properties.getCustodyBaseUrl());
    }

    @Override
    public void pull(String from, BigDecimal amount) {
        post("assets/pull", Map.of("account", from, "amount", amount.toPlainString()));
    }

    @Override
    public void push(String to, BigDecimal amount) {
        post("assets/push", Map.of("account", to, "amount", amount.toPlainString()));
    }

    @Override
    public void receiveNote(LoanKey loanKey, String seller) {
        post("notes/receive", Map.of(
                "platform", loanKey.platform(),
                "loanId", loanKey.loanId(),
                "from", seller));
    }

    @Override
    public void returnNote(LoanKey loanKey, String to) {
        post("notes/return", Map.of(
                "platform", loanKey.platform(),
                "loanId", loanKey.loanId(),
                "to", to));
    }

    @Override
    public void transferCollateral(CollateralRef collateral, String to) {
        post("collateral/transfer", Map.of(
                "collateralClass", collateral.collateralClass(),
                "tokenId", collateral.tokenId(),
                "to", to));
    }

    private void post(String path, Map<String, String> payload) {
        HttpUrl url = baseUrl.newBuilder().addPathSegments(path).build();
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unserializable custody payload for " + path, e);
        }

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() >= 400 && response.code() < 500) {
                log.warn("[Custody] transfer rejected: path={}, payload={}, code={}", path, payload, response.code());
                throw new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE, path + " rejected with " + response.code());
            }
            if (!response.isSuccessful()) {
                log.warn("[Custody] transfer failed: path={}, payload={}, code={}", path, payload, response.code());
                throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, path + " returned " + response.code());
            }
            log.info("[Custody] transfer done: path={}, payload={}", path, payload);
        } catch (IOException e) {
            log.error("[Custody] transfer error: path={}, payload={}", path, payload, e);
            throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, path, e);
        }
    }
}
