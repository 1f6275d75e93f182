package com.flagship.general_ledger.book;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A line of a ledger-effective entry, joined with its header for ledger display.
 */
@Value
public class PostedLine {
    UUID entryId;
    String entryNumber;
    LocalDate date;
    int orderNumber;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    UUID thirdPartyId;
}
