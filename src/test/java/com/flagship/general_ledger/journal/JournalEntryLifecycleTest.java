package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.chart.AccountService;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.outbox.OutboxEvent;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.period.FiscalPeriodService;
import com.flagship.general_ledger.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.general_ledger.support.LedgerFixtures.ACTOR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives journal entries through their whole lifecycle against PostgreSQL,
 * and checks that the database refuses to rewrite posted history on its own.
 */
class JournalEntryLifecycleTest extends AbstractIntegrationTest {

    private static final LocalDate JAN_5 = LocalDate.of(2024, 1, 5);

    @Autowired
    private JournalEntryStore store;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private FiscalPeriodService fiscalPeriodService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID voucherTypeId;
    private UUID periodId;
    private UUID cash;
    private UUID sales;

    @BeforeEach
    void setUp() {
        voucherTypeId = fixtures.voucherType("CI");
        periodId = fixtures.january2024();
        cash = fixtures.debitAccount("1105", "Cash");
        sales = fixtures.creditAccount("4135", "Sales");
    }

    @Test
    @DisplayName("Create, post and reverse an entry, with history and events for each step")
    void fullLifecycle() {
        printTestHeader("Create -> Post -> Reverse");

        // Given: a draft entry with an allocated number
        JournalEntry draft = store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "100.00"), ACTOR);
        printOutput("Draft", draft.getEntryNumber());
        assertEquals("CI-000001", draft.getEntryNumber());
        assertEquals(EntryStatus.DRAFT, store.findById(draft.getId()).getStatus());

        // When: posting and then reversing it
        JournalEntry posted = store.post(draft.getId(), ACTOR);
        Reversal reversal = store.reverse(posted.getId(), null, "Duplicated sale", "reviewer");
        printOutput("Reversal", reversal.getReversal().getEntryNumber());

        // Then: the original is REVERSED and points to a posted mirror of the same voucher type
        JournalEntry original = store.findById(draft.getId());
        JournalEntry mirror = store.findById(reversal.getReversal().getId());
        assertEquals(EntryStatus.REVERSED, original.getStatus());
        assertEquals(mirror.getId(), original.getReversedById());
        assertEquals(EntryStatus.POSTED, mirror.getStatus());
        assertEquals(original.getId(), mirror.getReversalOfId());
        assertEquals("CI-000002", mirror.getEntryNumber());
        assertEquals(0, new BigDecimal("100.00").compareTo(mirror.getLines().get(0).getCreditAmount()));

        List<String> transitions = store.findStatusHistory(draft.getId()).stream()
            .map(StatusChange::getNewStatus)
            .toList();
        assertEquals(List.of("DRAFT", "POSTED", "REVERSED"), transitions);
        assertEquals("Duplicated sale", store.findStatusHistory(draft.getId()).get(2).getComments());

        List<String> eventTypes = outboxService.getEventsForAggregate(draft.getId()).stream()
            .map(OutboxEvent::getEventType)
            .toList();
        assertEquals(List.of("JournalEntryPosted", "JournalEntryReversed"), eventTypes);
        assertEquals(1, outboxService.getEventsForAggregate(mirror.getId()).size());

        printSuccess("Lifecycle recorded in history and outbox");
    }

    @Test
    @DisplayName("Draft content can be replaced; posted content cannot")
    void updateOnlyDrafts() {
        printTestHeader("Update Draft vs Posted");

        JournalEntry draft = store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "100.00"), ACTOR);

        JournalEntry updated = store.update(draft.getId(),
            fixtures.entry(voucherTypeId, periodId, LocalDate.of(2024, 1, 6), cash, sales, "75.50"), ACTOR);
        assertEquals(new BigDecimal("75.50"), store.findById(draft.getId()).getTotalDebit());
        assertEquals(LocalDate.of(2024, 1, 6), updated.getDate());
        assertEquals(draft.getEntryNumber(), updated.getEntryNumber());

        store.post(draft.getId(), ACTOR);
        InvalidStateException e = assertThrows(InvalidStateException.class, () -> store.update(draft.getId(),
            fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "10.00"), ACTOR));
        printExpectedException(e);
    }

    @Test
    @DisplayName("Deleting a draft removes it but keeps a DELETED history row")
    void deleteDraft() {
        printTestHeader("Delete Draft");

        JournalEntry draft = store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "20.00"), ACTOR);

        store.delete(draft.getId(), ACTOR);

        assertThrows(NotFoundException.class, () -> store.findById(draft.getId()));
        assertEquals(0, fixtures.count("SELECT COUNT(*) FROM journal_entry_lines WHERE entry_id = ?", draft.getId()));
        List<StatusChange> history = store.findStatusHistory(draft.getId());
        assertEquals("DELETED", history.get(history.size() - 1).getNewStatus());
        printSuccess("Draft deleted, history kept");
    }

    @Test
    @DisplayName("Posted and reversed entries cannot be deleted or reversed twice")
    void terminalStatesRejectTransitions() {
        printTestHeader("Invalid Transitions");

        JournalEntry posted = store.post(
            store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "30.00"), ACTOR).getId(), ACTOR);

        assertThrows(InvalidStateException.class, () -> store.delete(posted.getId(), ACTOR));
        Reversal reversal = store.reverse(posted.getId(), null, "error", ACTOR);
        assertThrows(InvalidStateException.class, () -> store.reverse(posted.getId(), null, "again", ACTOR));
        assertThrows(InvalidStateException.class,
            () -> store.reverse(reversal.getReversal().getId(), null, "mirror", ACTOR));
        printSuccess("Terminal states held");
    }

    @Test
    @DisplayName("Posting into a period closed after the draft was created is rejected")
    void postIntoClosedPeriod() {
        printTestHeader("Closed Period");

        JournalEntry draft = store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "40.00"), ACTOR);
        fiscalPeriodService.closePeriod(periodId);

        ValidationException e = assertThrows(ValidationException.class, () -> store.post(draft.getId(), ACTOR));
        printExpectedException(e);
        assertTrue(e.getViolations().contains("Fiscal period 2024-01 is closed"));
        assertEquals(EntryStatus.DRAFT, store.findById(draft.getId()).getStatus());
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Reversal dated in a later open period lands in that period")
    void reverseIntoLaterPeriod() {
        printTestHeader("Reversal In Later Period");

        UUID february = fixtures.period("2024-02", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));
        JournalEntry posted = store.post(
            store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "60.00"), ACTOR).getId(), ACTOR);
        fiscalPeriodService.closePeriod(periodId);

        Reversal reversal = store.reverse(posted.getId(), LocalDate.of(2024, 2, 3), "late correction", ACTOR);

        assertEquals(february, reversal.getReversal().getFiscalPeriodId());
        assertEquals(LocalDate.of(2024, 2, 3), reversal.getReversal().getDate());
        printSuccess("Mirror posted in 2024-02");
    }

    @Test
    @DisplayName("Inactive accounts do not accept new entries")
    void inactiveAccount() {
        printTestHeader("Inactive Account");

        accountService.deactivate(sales);

        ValidationException e = assertThrows(ValidationException.class,
            () -> store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "10.00"), ACTOR));
        printExpectedException(e);
        assertTrue(e.getViolations().contains("Account 4135 is inactive"));
    }

    @Test
    @DisplayName("Unknown account is reported as not found")
    void unknownAccount() {
        assertThrows(NotFoundException.class, () -> store.create(
            fixtures.entry(voucherTypeId, periodId, JAN_5, cash, UUID.randomUUID(), "10.00"), ACTOR));
    }

    @Test
    @DisplayName("Database refuses to change or delete lines of a posted entry")
    void postedLinesAreAppendOnly() {
        printTestHeader("Database Guards");

        JournalEntry posted = store.post(
            store.create(fixtures.entry(voucherTypeId, periodId, JAN_5, cash, sales, "15.00"), ACTOR).getId(), ACTOR);

        DataAccessException update = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE journal_entry_lines SET debit_amount = 1 WHERE entry_id = ? AND debit_amount > 0", posted.getId()));
        printExpectedException(update);

        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("DELETE FROM journal_entries WHERE id = ?", posted.getId()));
        assertEquals(2, fixtures.count("SELECT COUNT(*) FROM journal_entry_lines WHERE entry_id = ?", posted.getId()));
    }
}
