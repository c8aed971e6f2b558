package com.lendingvault.engine.domain.gateway;

import com.lendingvault.engine.domain.model.CollateralRef;

public interface CollateralCustody {

    void transferCollateral(CollateralRef collateral, String to);
}
