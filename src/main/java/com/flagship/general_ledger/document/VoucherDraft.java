package com.flagship.general_ledger.document;

import com.flagship.general_ledger.journal.JournalEntryRequest;
import lombok.Value;

import java.util.List;

/**
 * Lines a {@link VoucherLineBuilder} derived from a document, and whether the entry is posted right away.
 */
@Value
public class VoucherDraft {
    String description;
    List<JournalEntryRequest.Line> lines;
    boolean postImmediately;
}
