package com.flagship.general_ledger.document;

import com.flagship.general_ledger.book.BalanceEngine;
import com.flagship.general_ledger.book.DateRange;
import com.flagship.general_ledger.exception.ConflictException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.EntryStatus;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryStore;
import com.flagship.general_ledger.outbox.OutboxEvent;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.general_ledger.support.LedgerFixtures.ACTOR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Voucher generation from legal documents and the cancellation cascade back to entries.
 */
class DocumentVoucherIntegrationTest extends AbstractIntegrationTest {

    private static final LocalDate JAN_8 = LocalDate.of(2024, 1, 8);

    @Autowired
    private DocumentVoucherBridge bridge;

    @Autowired
    private LegalDocumentService documentService;

    @Autowired
    private JournalEntryStore store;

    @Autowired
    private BalanceEngine balanceEngine;

    @Autowired
    private OutboxService outboxService;

    private UUID periodId;
    private UUID invoiceType;
    private UUID incomeVoucher;
    private UUID receivable;
    private UUID revenue;
    private UUID vatPayable;

    @BeforeEach
    void setUp() {
        periodId = fixtures.january2024();
        invoiceType = fixtures.documentType("FAC");
        incomeVoucher = fixtures.voucherType("CI");
        receivable = fixtures.debitAccount("1305", "Customers");
        revenue = fixtures.creditAccount("4135", "Sales");
        vatPayable = fixtures.creditAccount("2408", "VAT payable");
    }

    @Test
    @DisplayName("Registering documents allocates consecutive numbers per document type")
    void documentNumbering() {
        printTestHeader("Document Numbering");

        LegalDocument first = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "100.00", "0");
        LegalDocument second = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "200.00", "0");

        assertEquals("FAC-000001", first.getDocumentNumber());
        assertEquals("FAC-000002", second.getDocumentNumber());
        assertEquals(DocumentStatus.APPROVED, documentService.findById(first.getId()).getStatus());
    }

    @Test
    @DisplayName("Document dated outside its period is rejected")
    void documentOutsidePeriod() {
        assertThrows(ValidationException.class, () -> fixtures.approvedDocument(
            invoiceType, periodId, LocalDate.of(2024, 3, 1), "100.00", "0"));
    }

    @Test
    @DisplayName("Posted voucher splits tax and moves the customer balance")
    void generatePostedVoucher() {
        printTestHeader("Generate Voucher");

        // Given: an invoice of 1000 + 190 VAT and a rule that posts right away
        fixtures.postingRule(invoiceType, incomeVoucher, receivable, revenue, vatPayable, true);
        LegalDocument invoice = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "1000.00", "190.00");
        printInput("Document", invoice.getDocumentNumber());

        // When
        JournalEntry voucher = bridge.generateVoucher(invoice.getId(), incomeVoucher, ACTOR);
        printOutput("Voucher", voucher.getEntryNumber() + " " + voucher.getStatus());

        // Then
        assertEquals(EntryStatus.POSTED, voucher.getStatus());
        JournalEntry stored = store.findById(voucher.getId());
        assertEquals(invoice.getId(), stored.getDocumentId());
        assertEquals(invoiceType, stored.getDocumentTypeId());
        assertEquals("INV-TEST", stored.getReference());
        assertEquals(3, stored.getLines().size());
        assertEquals(0, new BigDecimal("1190").compareTo(
            balanceEngine.ledgerFor(receivable, DateRange.unbounded(), null).getClosingBalance()));
        assertEquals(0, new BigDecimal("190").compareTo(
            balanceEngine.ledgerFor(vatPayable, DateRange.unbounded(), null).getClosingBalance()));
        printSuccess("Voucher posted from document");
    }

    @Test
    @DisplayName("Generating the same voucher type twice for one document conflicts")
    void generateTwice() {
        printTestHeader("Duplicate Voucher");

        fixtures.postingRule(invoiceType, incomeVoucher, receivable, revenue, null, false);
        LegalDocument invoice = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "300.00", "0");
        JournalEntry first = bridge.generateVoucher(invoice.getId(), incomeVoucher, ACTOR);

        ConflictException e = assertThrows(ConflictException.class,
            () -> bridge.generateVoucher(invoice.getId(), incomeVoucher, ACTOR));
        printExpectedException(e);

        assertEquals(first.getEntryNumber(), e.getDetails().get("entry_number"));
        assertEquals(1, fixtures.count("SELECT COUNT(*) FROM journal_entries WHERE document_id = ?", invoice.getId()));
    }

    @Test
    @DisplayName("Draft documents and documents without a rule do not generate vouchers")
    void generateRejected() {
        LegalDocument draft = documentService.register(RegisterDocumentRequest.builder()
            .documentTypeId(invoiceType)
            .date(JAN_8)
            .subtotal(new BigDecimal("10.00"))
            .currency("USD")
            .fiscalPeriodId(periodId)
            .build(), ACTOR);
        assertThrows(InvalidStateException.class, () -> bridge.generateVoucher(draft.getId(), incomeVoucher, ACTOR));

        LegalDocument approved = documentService.approve(draft.getId(), ACTOR);
        assertThrows(ValidationException.class, () -> bridge.generateVoucher(approved.getId(), incomeVoucher, ACTOR));
    }

    @Test
    @DisplayName("Cancelling a document cancels its draft voucher")
    void cancelCascadesToDraftVoucher() {
        printTestHeader("Cancel Cascade");

        fixtures.postingRule(invoiceType, incomeVoucher, receivable, revenue, null, false);
        LegalDocument invoice = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "450.00", "0");
        JournalEntry voucher = bridge.generateVoucher(invoice.getId(), incomeVoucher, ACTOR);

        DocumentCancellation result = bridge.cancelDocument(invoice.getId(), "Issued by mistake", ACTOR);

        assertEquals(DocumentStatus.CANCELLED, documentService.findById(invoice.getId()).getStatus());
        assertEquals(1, result.getCancelledEntries().size());
        JournalEntry cancelled = store.findById(voucher.getId());
        assertEquals(EntryStatus.CANCELLED, cancelled.getStatus());
        assertTrue(cancelled.getCancellationReason().contains("Issued by mistake"));

        List<String> documentEvents = outboxService.getEventsForAggregate(invoice.getId()).stream()
            .map(OutboxEvent::getEventType)
            .toList();
        assertEquals(List.of("LegalDocumentCancelled"), documentEvents);
        printSuccess("Draft voucher cancelled with its document");
    }

    @Test
    @DisplayName("Posted voucher blocks cancellation until it is reversed")
    void postedVoucherBlocksCancellation() {
        printTestHeader("Cancel Blocked By Posted Voucher");

        fixtures.postingRule(invoiceType, incomeVoucher, receivable, revenue, null, true);
        LegalDocument invoice = fixtures.approvedDocument(invoiceType, periodId, JAN_8, "450.00", "0");
        JournalEntry voucher = bridge.generateVoucher(invoice.getId(), incomeVoucher, ACTOR);

        ConflictException e = assertThrows(ConflictException.class,
            () -> bridge.cancelDocument(invoice.getId(), "Returned", ACTOR));
        printExpectedException(e);
        assertEquals(voucher.getEntryNumber(), e.getDetails().get("blocking_entry_numbers"));
        assertEquals(DocumentStatus.APPROVED, documentService.findById(invoice.getId()).getStatus());

        store.reverse(voucher.getId(), null, "Returned", ACTOR);
        DocumentCancellation result = bridge.cancelDocument(invoice.getId(), "Returned", ACTOR);

        assertTrue(result.getCancelledEntries().isEmpty());
        assertEquals(EntryStatus.REVERSED, store.findById(voucher.getId()).getStatus());
        assertThrows(InvalidStateException.class, () -> bridge.cancelDocument(invoice.getId(), "Again", ACTOR));
        printSuccess("Cancellation allowed after reversal");
    }
}
