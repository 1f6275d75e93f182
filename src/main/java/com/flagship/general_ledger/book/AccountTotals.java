package com.flagship.general_ledger.book;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Debit and credit sums of one account over ledger-effective lines.
 */
@Value
public class AccountTotals {
    UUID accountId;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
}
