package com.flagship.general_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One account movement inside a journal entry. Exactly one side is non-zero.
 */
@Value
public class JournalLine {
    UUID id;
    int orderNumber;
    UUID accountId;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    UUID thirdPartyId;

    /**
     * debit - credit
     */
    public BigDecimal delta() {
        return debitAmount.subtract(creditAmount);
    }

    public boolean isDebit() {
        return debitAmount.signum() > 0;
    }

    /**
     * Same account and amount on the opposite side, for reversing entries.
     */
    JournalLine mirrored(UUID newId, String newDescription) {
        return new JournalLine(newId, orderNumber, accountId, newDescription,
            creditAmount, debitAmount, thirdPartyId);
    }
}
