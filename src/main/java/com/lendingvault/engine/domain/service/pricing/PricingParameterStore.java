package com.lendingvault.engine.domain.service.pricing;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.RateModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Administered pricing parameters. Each setter replaces a whole record, so readers see either
 * the old or the new parameters.
 */
@Slf4j
@Component
public class PricingParameterStore {

    private final long minimumLoanDuration;
    private final Map<String, CollateralRiskParameters> collateralParameters = new ConcurrentHashMap<>();
    private volatile RateModel utilizationModel;

    public PricingParameterStore(PricingProperties properties) {
        this.minimumLoanDuration = properties.getMinimumLoanDuration().getSeconds();
        this.utilizationModel = properties.getUtilization().toRateModel();
        properties.getCollaterals().forEach((collateralClass, collateral) ->
                collateralParameters.put(collateralClass, collateral.toParameters()));

        log.info("[Pricer] parameters loaded: minimumLoanDuration={}s, collateralClasses={}",
                minimumLoanDuration, collateralParameters.keySet());
    }

    public long minimumLoanDuration() {
        return minimumLoanDuration;
    }

    public RateModel utilizationModel() {
        return utilizationModel;
    }

    public Optional<CollateralRiskParameters> collateralParameters(String collateralClass) {
        return Optional.ofNullable(collateralParameters.get(collateralClass));
    }

    public Map<String, CollateralRiskParameters> allCollateralParameters() {
        return Map.copyOf(collateralParameters);
    }

    public void setUtilizationModel(RateModel model) {
        VaultException.require(model != null, VaultErrorCode.INVALID_PARAMETERS, "utilization model missing");
        this.utilizationModel = model;
        log.info("[Pricer] utilization model replaced: {}", model);
    }

    public void setCollateralParameters(String collateralClass, CollateralRiskParameters parameters) {
        VaultException.require(collateralClass != null && !collateralClass.isBlank(),
                VaultErrorCode.INVALID_ADDRESS, "collateral class missing");
        VaultException.require(parameters != null, VaultErrorCode.INVALID_PARAMETERS, "collateral parameters missing");
        collateralParameters.put(collateralClass, parameters);
        log.info("[Pricer] collateral parameters replaced: class={}, enabled={}, weights={}",
                collateralClass, parameters.enabled(), parameters.weights());
    }
}
