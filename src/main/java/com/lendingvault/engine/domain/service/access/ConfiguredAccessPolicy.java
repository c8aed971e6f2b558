package com.lendingvault.engine.domain.service.access;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class ConfiguredAccessPolicy implements AccessPolicy {

    private final Map<VaultRole, Set<String>> members = new EnumMap<>(VaultRole.class);

    public ConfiguredAccessPolicy(AccessProperties properties) {
        members.put(VaultRole.ADMIN, Set.copyOf(properties.getAdmins()));
        members.put(VaultRole.COLLATERAL_LIQUIDATOR, Set.copyOf(properties.getCollateralLiquidators()));
        log.info("[Access] roles loaded: admins={}, collateralLiquidators={}",
                properties.getAdmins().size(), properties.getCollateralLiquidators().size());
    }

    @Override
    public boolean hasRole(String account, VaultRole role) {
        return account != null && members.getOrDefault(role, Set.of()).contains(account);
    }

    @Override
    public void requireRole(String account, VaultRole role) {
        if (!hasRole(account, role)) {
            log.warn("[Access] denied: account={}, role={}", account, role);
            throw new VaultException(VaultErrorCode.INVALID_CALLER, "account=" + account + ", role=" + role);
        }
    }
}
