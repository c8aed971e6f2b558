package com.lendingvault.engine.domain.service.access;

public interface AccessPolicy {

    boolean hasRole(String account, VaultRole role);

    /**
     * @throws com.lendingvault.engine.domain.exception.VaultException with INVALID_CALLER
     */
    void requireRole(String account, VaultRole role);
}
