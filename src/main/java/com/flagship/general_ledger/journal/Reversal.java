package com.flagship.general_ledger.journal;

import lombok.Value;

/**
 * Outcome of reversing an entry: the original, now REVERSED, and its posted mirror.
 */
@Value
public class Reversal {
    JournalEntry original;
    JournalEntry reversal;
}
