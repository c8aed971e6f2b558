package com.lendingvault.engine.domain.model;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;

import java.util.Locale;

public enum TrancheId {
    SENIOR,
    JUNIOR;

    public static TrancheId fromString(String value) {
        if (value == null) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "tranche missing");
        }
        try {
            return TrancheId.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "unknown tranche " + value, e);
        }
    }
}
