package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryTest {

    private final UUID cash = UUID.randomUUID();
    private final UUID revenue = UUID.randomUUID();
    private final UUID thirdParty = UUID.randomUUID();

    private JournalEntry draft() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .voucherTypeId(UUID.randomUUID())
            .date(LocalDate.of(2024, 1, 5))
            .description("Cash sale")
            .currency("USD")
            .fiscalPeriodId(UUID.randomUUID())
            .thirdPartyId(thirdParty)
            .lines(List.of(
                JournalEntryRequest.Line.debit(cash, new BigDecimal("100"), "cash in"),
                JournalEntryRequest.Line.credit(revenue, new BigDecimal("100"), "sale")))
            .build();
        return JournalEntry.draft(UUID.randomUUID(), "CI-000001", request, null, "alice");
    }

    @Test
    @DisplayName("Draft numbers its lines and derives totals from them")
    void draftDerivesTotals() {
        JournalEntry entry = draft();

        assertEquals(EntryStatus.DRAFT, entry.getStatus());
        assertEquals(new BigDecimal("100.00"), entry.getTotalDebit());
        assertEquals(new BigDecimal("100.00"), entry.getTotalCredit());
        assertEquals(1, entry.getLines().get(0).getOrderNumber());
        assertEquals(2, entry.getLines().get(1).getOrderNumber());
        assertEquals(thirdParty, entry.getLines().get(1).getThirdPartyId(), "line inherits header third party");
        assertEquals(BigDecimal.ONE, entry.getExchangeRate());
    }

    @Test
    @DisplayName("Posting a draft records who posted it")
    void postDraft() {
        JournalEntry posted = draft().post("bob");

        assertEquals(EntryStatus.POSTED, posted.getStatus());
        assertEquals("bob", posted.getPostedBy());
        assertNotNull(posted.getPostedAt());
    }

    @Test
    @DisplayName("Posting an unbalanced draft fails")
    void postUnbalanced() {
        JournalEntry entry = draft();
        JournalLine skewed = new JournalLine(UUID.randomUUID(), 2, revenue, "sale",
            BigDecimal.ZERO.setScale(2), new BigDecimal("90.00"), null);
        JournalEntry unbalanced = entry.toBuilder().lines(List.of(entry.getLines().get(0), skewed)).build();

        ValidationException e = assertThrows(ValidationException.class, () -> unbalanced.post("bob"));
        assertTrue(e.getMessage().contains("difference=10.00"), e.getMessage());
    }

    @Test
    @DisplayName("Posted entries cannot be posted, edited or cancelled")
    void postedIsFrozen() {
        JournalEntry posted = draft().post("bob");

        assertThrows(InvalidStateException.class, () -> posted.post("bob"));
        assertThrows(InvalidStateException.class, () -> posted.ensureEditable("update"));
        assertThrows(InvalidStateException.class, () -> posted.cancel("gone"));
    }

    @Test
    @DisplayName("Drafts cannot be reversed")
    void draftCannotBeReversed() {
        assertThrows(InvalidStateException.class, () -> draft().markReversed(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Mirror swaps debit and credit and links back to the original")
    void mirrorSwapsSides() {
        JournalEntry posted = draft().post("bob");
        UUID mirrorId = UUID.randomUUID();

        JournalEntry mirror = posted.mirror(mirrorId, "CI-000002", LocalDate.of(2024, 1, 20),
            posted.getFiscalPeriodId(), "duplicate", "carol");

        assertEquals(EntryStatus.DRAFT, mirror.getStatus());
        assertEquals(posted.getId(), mirror.getReversalOfId());
        assertEquals("Reversal of CI-000001: duplicate", mirror.getDescription());
        assertEquals(LocalDate.of(2024, 1, 20), mirror.getDate());
        assertEquals(cash, mirror.getLines().get(0).getAccountId());
        assertEquals(new BigDecimal("100.00"), mirror.getLines().get(0).getCreditAmount());
        assertEquals(0, mirror.getLines().get(0).getDebitAmount().signum());
        assertEquals("Reversal: cash in", mirror.getLines().get(0).getDescription());
        assertTrue(mirror.isBalanced());
    }

    @Test
    @DisplayName("A reversing entry cannot itself be reversed")
    void reversalOfReversalRejected() {
        JournalEntry posted = draft().post("bob");
        JournalEntry mirror = posted.mirror(UUID.randomUUID(), "CI-000002", posted.getDate(),
            posted.getFiscalPeriodId(), null, "carol").post("carol");

        assertEquals("Reversal of CI-000001", mirror.getDescription());
        assertThrows(InvalidStateException.class, () -> mirror.markReversed(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Cancelling a draft keeps the reason")
    void cancelDraft() {
        JournalEntry cancelled = draft().cancel("document voided");

        assertEquals(EntryStatus.CANCELLED, cancelled.getStatus());
        assertEquals("document voided", cancelled.getCancellationReason());
    }

    @ParameterizedTest
    @EnumSource(EntryStatus.class)
    @DisplayName("Nothing transitions back to DRAFT")
    void noStatusReturnsToDraft(EntryStatus status) {
        assertFalse(status.canTransitionTo(EntryStatus.DRAFT));
    }

    @Test
    @DisplayName("Only posted and reversed entries affect the books")
    void ledgerEffectiveStatuses() {
        assertFalse(EntryStatus.DRAFT.isLedgerEffective());
        assertTrue(EntryStatus.POSTED.isLedgerEffective());
        assertTrue(EntryStatus.REVERSED.isLedgerEffective());
        assertFalse(EntryStatus.CANCELLED.isLedgerEffective());
    }
}
