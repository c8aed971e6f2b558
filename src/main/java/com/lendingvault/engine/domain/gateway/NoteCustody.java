package com.lendingvault.engine.domain.gateway;

import com.lendingvault.engine.domain.model.LoanKey;

public interface NoteCustody {

    /**
     * Moves the promissory note of {@code loanKey} from {@code seller} into the vault.
     */
    void receiveNote(LoanKey loanKey, String seller);

    /**
     * Hands a received note back, used when the purchase that took it does not complete.
     */
    void returnNote(LoanKey loanKey, String to);
}
