package com.lendingvault.engine.domain.service.pricing;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.CollateralValueOracle;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.CollateralRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Administrator-maintained collateral values. A per-token value overrides the class value.
 */
@Slf4j
@Component
public class StaticCollateralValueOracle implements CollateralValueOracle {

    private final Map<String, BigDecimal> classValues = new ConcurrentHashMap<>();
    private final Map<CollateralRef, BigDecimal> tokenValues = new ConcurrentHashMap<>();

    public StaticCollateralValueOracle(PricingProperties properties) {
        properties.getCollaterals().forEach((collateralClass, collateral) -> {
            if (collateral.getValue() != null) {
                classValues.put(collateralClass, FixedPoint.normalize(collateral.getValue()));
            }
        });
    }

    @Override
    public Optional<BigDecimal> collateralValue(CollateralRef collateral) {
        BigDecimal tokenValue = tokenValues.get(collateral);
        if (tokenValue != null) {
            return Optional.of(tokenValue);
        }
        return Optional.ofNullable(classValues.get(collateral.collateralClass()));
    }

    public void setCollateralValue(String collateralClass, String tokenId, BigDecimal value) {
        VaultException.require(collateralClass != null && !collateralClass.isBlank(),
                VaultErrorCode.INVALID_ADDRESS, "collateral class missing");
        VaultException.require(value != null && value.signum() > 0,
                VaultErrorCode.INVALID_PARAMETERS, "collateral value must be positive");
        BigDecimal normalized = FixedPoint.normalize(value);
        if (tokenId == null || tokenId.isBlank()) {
            classValues.put(collateralClass, normalized);
        } else {
            tokenValues.put(new CollateralRef(collateralClass, tokenId), normalized);
        }
        log.info("[Oracle] collateral value set: class={}, token={}, value={}",
                collateralClass, tokenId, normalized.toPlainString());
    }
}
