package com.flagship.general_ledger.chart;

import java.math.BigDecimal;

/**
 * Side on which an account's balance conventionally grows.
 * Assets and expenses are debit-normal; liabilities, equity and income are credit-normal.
 */
public enum NormalBalance {
    DEBIT,
    CREDIT;

    /**
     * Signed contribution of a movement to a balance kept on this side.
     * DEBIT accumulates (debit - credit), CREDIT accumulates (credit - debit).
     */
    public BigDecimal signed(BigDecimal debitAmount, BigDecimal creditAmount) {
        BigDecimal delta = debitAmount.subtract(creditAmount);
        return this == DEBIT ? delta : delta.negate();
    }
}
