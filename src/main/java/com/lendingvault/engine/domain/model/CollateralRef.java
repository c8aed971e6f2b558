package com.lendingvault.engine.domain.model;

/**
 * Non-fungible collateral backing a loan. Risk parameters are keyed by {@code collateralClass}.
 */
public record CollateralRef(String collateralClass, String tokenId) {

    @Override
    public String toString() {
        return collateralClass + "#" + tokenId;
    }
}
