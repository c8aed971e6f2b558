package com.lendingvault.engine.domain.service.pricing;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.CollateralValueOracle;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.LoanQuote;
import com.lendingvault.engine.domain.model.RateComponentWeights;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Risk-based present value of a loan's repayment. Pure with respect to the ledger: reads the
 * current pricing parameters and collateral value only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanPricer {

    private final PricingParameterStore parameterStore;
    private final CollateralValueOracle collateralValueOracle;

    public LoanQuote priceLoan(CollateralRef collateral, BigDecimal principal, BigDecimal repayment,
                               long durationRemaining, BigDecimal utilization) {
        if (durationRemaining <= 0 || durationRemaining < parameterStore.minimumLoanDuration()) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_TIME_REMAINING,
                    "remaining=" + durationRemaining + "s, minimum=" + parameterStore.minimumLoanDuration() + "s");
        }

        CollateralRiskParameters parameters = parameterStore.collateralParameters(collateral.collateralClass())
                .filter(CollateralRiskParameters::enabled)
                .orElseThrow(() -> new VaultException(VaultErrorCode.UNSUPPORTED_COLLATERAL,
                        collateral.collateralClass()));

        BigDecimal collateralValue = collateralValueOracle.collateralValue(collateral)
                .filter(FixedPoint::isPositive)
                .orElseThrow(() -> new VaultException(VaultErrorCode.UNSUPPORTED_COLLATERAL,
                        "no collateral value for " + collateral));

        BigDecimal loanToValue = FixedPoint.div(principal, collateralValue);

        BigDecimal utilizationRate = parameterStore.utilizationModel().evaluate(utilization);
        BigDecimal loanToValueRate = parameters.loanToValueModel().evaluate(loanToValue);
        BigDecimal durationRate = parameters.durationModel().evaluate(FixedPoint.of(durationRemaining));

        RateComponentWeights weights = parameters.weights();
        BigDecimal weightedSum = utilizationRate.multiply(BigDecimal.valueOf(weights.utilization()))
                .add(loanToValueRate.multiply(BigDecimal.valueOf(weights.loanToValue())))
                .add(durationRate.multiply(BigDecimal.valueOf(weights.duration())));
        BigDecimal discountRate = FixedPoint.div(weightedSum, RateComponentWeights.TOTAL);

        BigDecimal discountFactor = FixedPoint.add(FixedPoint.ONE, FixedPoint.mul(discountRate, durationRemaining));
        BigDecimal purchasePrice = FixedPoint.div(repayment, discountFactor);

        log.debug("[Pricer] quote: collateral={}, ltv={}, utilization={}, discountRate={}, price={}",
                collateral, loanToValue.toPlainString(), utilization.toPlainString(),
                discountRate.toPlainString(), purchasePrice.toPlainString());

        return new LoanQuote(purchasePrice, discountRate, utilization, loanToValue,
                utilizationRate, loanToValueRate, durationRate, durationRemaining);
    }
}
