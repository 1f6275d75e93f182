package com.flagship.general_ledger.book;

import com.flagship.general_ledger.journal.EntryStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Criteria of the Libro Diario. A null field does not filter.
 */
@Value
@Builder
public class JournalBookFilter {

    @Builder.Default
    DateRange range = DateRange.unbounded();

    /**
     * Null means every ledger-effective status.
     */
    EntryStatus status;

    UUID thirdPartyId;

    UUID fiscalPeriodId;

    /**
     * Case-insensitive substring of the entry number.
     */
    String entryNumber;

    int page;

    /**
     * Zero or negative means the configured default.
     */
    int size;
}
