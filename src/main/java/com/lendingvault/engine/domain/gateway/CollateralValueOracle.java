package com.lendingvault.engine.domain.gateway;

import com.lendingvault.engine.domain.model.CollateralRef;

import java.math.BigDecimal;
import java.util.Optional;

public interface CollateralValueOracle {

    /**
     * Value of the collateral in deposit-asset units, empty when the collateral is not priced.
     */
    Optional<BigDecimal> collateralValue(CollateralRef collateral);
}
