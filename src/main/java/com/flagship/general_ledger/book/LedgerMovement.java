package com.flagship.general_ledger.book;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class LedgerMovement {
    UUID entryId;
    String entryNumber;
    LocalDate date;
    int orderNumber;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    UUID thirdPartyId;
    BigDecimal runningBalance;
}
