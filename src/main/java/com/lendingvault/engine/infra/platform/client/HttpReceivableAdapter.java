package com.lendingvault.engine.infra.platform.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.ReceivableAdapter;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.LoanTerms;
import com.lendingvault.engine.infra.platform.dto.PlatformLoanResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Receivable adapter over a lending platform's REST API:
 * {@code GET /loans/{id}} and {@code POST /loans/{id}/liquidate}.
 */
@Slf4j
public class HttpReceivableAdapter implements ReceivableAdapter {

    private final String platform;
    private final HttpUrl baseUrl;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpReceivableAdapter(String platform, String baseUrl, OkHttpClient okHttpClient,
                                 ObjectMapper objectMapper, Clock clock) {
        this.platform = platform;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String platform() {
        return platform;
    }

    @Override
    public boolean isSupported(String loanId) {
        return fetchLoan(loanId)
                .map(loan -> PlatformLoanResponse.STATUS_ACTIVE.equals(loan.getStatus())
                        && loan.getPrincipal() != null && loan.getRepayment() != null
                        && loan.getCollateralClass() != null)
                .orElse(false);
    }

    @Override
    public LoanTerms getLoanTerms(String loanId) {
        PlatformLoanResponse loan = fetchLoan(loanId)
                .orElseThrow(() -> new VaultException(VaultErrorCode.UNSUPPORTED_NOTE_TOKEN,
                        "loan not found: " + platform + ":" + loanId));
        return new LoanTerms(loan.getPrincipal(), loan.getRepayment(), loan.getStartTime(), loan.getDuration(),
                new CollateralRef(loan.getCollateralClass(), loan.getCollateralTokenId()), loan.getBorrower());
    }

    @Override
    public boolean isRepaid(String loanId) {
        return hasStatus(loanId, PlatformLoanResponse.STATUS_REPAID);
    }

    @Override
    public boolean isLiquidated(String loanId) {
        return hasStatus(loanId, PlatformLoanResponse.STATUS_LIQUIDATED);
    }

    @Override
    public boolean isExpired(String loanId) {
        long now = clock.instant().getEpochSecond();
        return fetchLoan(loanId)
                .map(loan -> PlatformLoanResponse.STATUS_ACTIVE.equals(loan.getStatus()) && now > loan.maturity())
                .orElse(false);
    }

    @Override
    public void liquidate(String loanId) {
        HttpUrl url = loanUrl(loanId).newBuilder().addPathSegment("liquidate").build();
        Request request = new Request.Builder().url(url).post(RequestBody.create(new byte[0])).build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Platform] liquidate failed: platform={}, loanId={}, code={}", platform, loanId, response.code());
                throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE,
                        "liquidate " + platform + ":" + loanId + " returned " + response.code());
            }
            log.info("[Platform] liquidate requested: platform={}, loanId={}", platform, loanId);
        } catch (IOException e) {
            log.error("[Platform] liquidate request error: platform={}, loanId={}", platform, loanId, e);
            throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, platform + ":" + loanId, e);
        }
    }

    private boolean hasStatus(String loanId, String status) {
        return fetchLoan(loanId).map(loan -> status.equals(loan.getStatus())).orElse(false);
    }

    /**
     * Empty when the platform does not know the loan. Any other failure is an error: loan state
     * is never guessed.
     */
    Optional<PlatformLoanResponse> fetchLoan(String loanId) {
        Request request = new Request.Builder().url(loanUrl(loanId)).get().build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                log.debug("[Platform] loan not found: platform={}, loanId={}", platform, loanId);
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                log.warn("[Platform] loan request failed: platform={}, loanId={}, code={}", platform, loanId, response.code());
                throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE,
                        "loan " + platform + ":" + loanId + " returned " + response.code());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, "empty body for " + platform + ":" + loanId);
            }

            PlatformLoanResponse loan = objectMapper.readValue(body.string(), PlatformLoanResponse.class);
            log.debug("[Platform] loan received: platform={}, loanId={}, status={}", platform, loanId, loan.getStatus());
            return Optional.of(loan);

        } catch (IOException e) {
            log.error("[Platform] loan request error: platform={}, loanId={}", platform, loanId, e);
            throw new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, platform + ":" + loanId, e);
        }
    }

    private HttpUrl loanUrl(String loanId) {
        return baseUrl.newBuilder()
                .addPathSegment("loans")
                .addPathSegment(loanId)
                .build();
    }
}
