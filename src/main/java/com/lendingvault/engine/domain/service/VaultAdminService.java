package com.lendingvault.engine.domain.service;

import com.lendingvault.engine.domain.gateway.AssetTransfer;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.RateModel;
import com.lendingvault.engine.domain.service.access.AccessPolicy;
import com.lendingvault.engine.domain.service.access.VaultRole;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.domain.service.pricing.PricingParameterStore;
import com.lendingvault.engine.domain.service.pricing.StaticCollateralValueOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Service
@RequiredArgsConstructor
public class VaultAdminService {

    private final AccessPolicy accessPolicy;
    private final TrancheLedger ledger;
    private final PricingParameterStore parameterStore;
    private final StaticCollateralValueOracle collateralValueOracle;
    private final AssetTransfer assetTransfer;

    public void setUtilizationModel(String caller, RateModel model) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        parameterStore.setUtilizationModel(model);
    }

    public void setCollateralParameters(String caller, String collateralClass, CollateralRiskParameters parameters) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        parameterStore.setCollateralParameters(collateralClass, parameters);
    }

    public void setCollateralValue(String caller, String collateralClass, String tokenId, BigDecimal value) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        collateralValueOracle.setCollateralValue(collateralClass, tokenId, value);
    }

    public void setSeniorTrancheRate(String caller, BigDecimal annualRate) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        ledger.setSeniorTrancheRate(annualRate);
    }

    public void setReserveRatio(String caller, BigDecimal ratio) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        ledger.setReserveRatio(ratio);
    }

    public void setAdminFeeRate(String caller, BigDecimal rate) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        ledger.setAdminFeeRate(rate);
    }

    public void setPaused(String caller, boolean paused) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        ledger.setPaused(paused);
    }

    public BigDecimal withdrawAdminFees(String caller, String to, BigDecimal amount) {
        accessPolicy.requireRole(caller, VaultRole.ADMIN);
        VaultException.require(to != null && !to.isBlank(), VaultErrorCode.INVALID_ADDRESS);
        BigDecimal withdrawn = ledger.withdrawAdminFees(amount);
        assetTransfer.push(to, withdrawn);
        return withdrawn;
    }
}
