package com.lendingvault.engine.infra.custody;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.infra.platform.config.IntegrationProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

import static com.lendingvault.engine.support.VaultAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class HttpCustodyClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private HttpCustodyClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        IntegrationProperties properties = new IntegrationProperties();
        properties.setCustodyBaseUrl(server.url("/custody").toString());
        client = new HttpCustodyClient(new OkHttpClient(), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private JsonNode takeBody(String expectedPath) throws Exception {
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo(expectedPath);
        return objectMapper.readTree(request.getBody().readUtf8());
    }

    @Test
    void pullPostsAccountAndAmount() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        client.pull("alice", new BigDecimal("10.5"));

        JsonNode body = takeBody("/custody/assets/pull");
        assertThat(body.get("account").asText()).isEqualTo("alice");
        assertThat(body.get("amount").asText()).isEqualTo("10.5");
    }

    @Test
    void pushPostsToPushEndpoint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        client.push("seller", new BigDecimal("2"));

        assertThat(takeBody("/custody/assets/push").get("account").asText()).isEqualTo("seller");
    }

    @Test
    void noteAndCollateralTransfers() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(200));

        client.receiveNote(new LoanKey("demo", "1"), "seller");
        client.transferCollateral(new CollateralRef("demo-nft", "7"), "liquidator");

        JsonNode note = takeBody("/custody/notes/receive");
        assertThat(note.get("loanId").asText()).isEqualTo("1");
        assertThat(note.get("from").asText()).isEqualTo("seller");
        JsonNode collateral = takeBody("/custody/collateral/transfer");
        assertThat(collateral.get("tokenId").asText()).isEqualTo("7");
        assertThat(collateral.get("to").asText()).isEqualTo("liquidator");
    }

    @Test
    void returnNotePostsToReturnEndpoint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        client.returnNote(new LoanKey("demo", "1"), "seller");

        JsonNode note = takeBody("/custody/notes/return");
        assertThat(note.get("platform").asText()).isEqualTo("demo");
        assertThat(note.get("loanId").asText()).isEqualTo("1");
        assertThat(note.get("to").asText()).isEqualTo("seller");
    }

    @Test
    void rejectedTransferIsInsufficientBalance() {
        server.enqueue(new MockResponse().setResponseCode(409));

        assertRejected(() -> client.pull("alice", BigDecimal.TEN), VaultErrorCode.INSUFFICIENT_BALANCE);
    }

    @Test
    void serverFailureIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertRejected(() -> client.push("alice", BigDecimal.TEN), VaultErrorCode.PLATFORM_UNAVAILABLE);
    }
}
