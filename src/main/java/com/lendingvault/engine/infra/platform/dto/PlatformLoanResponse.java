package com.lendingvault.engine.infra.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlatformLoanResponse {

    public static final String STATUS_ACTIVE = "ACTIVE";
    public static final String STATUS_REPAID = "REPAID";
    public static final String STATUS_LIQUIDATED = "LIQUIDATED";

    private String loanId;
    private BigDecimal principal;
    private BigDecimal repayment;
    private long startTime;
    private long duration;
    private String collateralClass;
    private String collateralTokenId;
    private String borrower;
    private String status;

    public long maturity() {
        return startTime + duration;
    }
}
