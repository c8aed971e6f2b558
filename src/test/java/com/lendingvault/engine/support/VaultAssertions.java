package com.lendingvault.engine.support;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import org.assertj.core.api.ThrowableAssert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class VaultAssertions {

    private VaultAssertions() {
    }

    public static void assertRejected(ThrowableAssert.ThrowingCallable call, VaultErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(VaultException.class)
                .satisfies(e -> assertThat(((VaultException) e).getErrorCode()).isEqualTo(expected));
    }
}
