package com.flagship.general_ledger.document;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LegalDocumentTest {

    private static RegisterDocumentRequest.RegisterDocumentRequestBuilder invoice() {
        return RegisterDocumentRequest.builder()
            .documentTypeId(UUID.randomUUID())
            .date(LocalDate.of(2024, 1, 8))
            .subtotal(new BigDecimal("1000"))
            .taxAmount(new BigDecimal("190"))
            .currency("USD")
            .fiscalPeriodId(UUID.randomUUID());
    }

    @Test
    @DisplayName("Registered document is a DRAFT whose total is subtotal plus tax")
    void registerComputesTotal() {
        LegalDocument document = LegalDocument.register(UUID.randomUUID(), "FAC-000001", invoice().build(), "alice");

        assertEquals(DocumentStatus.DRAFT, document.getStatus());
        assertEquals(new BigDecimal("1190.00"), document.getTotalAmount());
        assertEquals(BigDecimal.ONE, document.getExchangeRate());
    }

    @Test
    @DisplayName("Missing tax counts as zero")
    void registerWithoutTax() {
        LegalDocument document = LegalDocument.register(UUID.randomUUID(), "FAC-000001",
            invoice().taxAmount(null).build(), "alice");

        assertEquals(new BigDecimal("0.00"), document.getTaxAmount());
        assertEquals(new BigDecimal("1000.00"), document.getTotalAmount());
    }

    @Test
    @DisplayName("Amounts with more than two decimals are rejected")
    void registerRejectsPrecision() {
        assertThrows(ValidationException.class, () -> LegalDocument.register(UUID.randomUUID(), "FAC-000001",
            invoice().subtotal(new BigDecimal("10.005")).build(), "alice"));
    }

    @Test
    @DisplayName("Approve then cancel; a cancelled document accepts nothing further")
    void lifecycle() {
        LegalDocument draft = LegalDocument.register(UUID.randomUUID(), "FAC-000001", invoice().build(), "alice");

        LegalDocument approved = draft.approve("bob");
        assertTrue(approved.isApproved());
        assertEquals("bob", approved.getApprovedBy());
        assertThrows(InvalidStateException.class, () -> approved.approve("bob"));

        LegalDocument cancelled = approved.cancel("wrong customer", "carol");
        assertEquals(DocumentStatus.CANCELLED, cancelled.getStatus());
        assertEquals("wrong customer", cancelled.getCancellationReason());
        assertThrows(InvalidStateException.class, () -> cancelled.cancel("again", "carol"));
        assertThrows(InvalidStateException.class, () -> cancelled.approve("carol"));
    }

    @Test
    @DisplayName("Cancelling requires a reason")
    void cancelRequiresReason() {
        LegalDocument draft = LegalDocument.register(UUID.randomUUID(), "FAC-000001", invoice().build(), "alice");

        assertThrows(ValidationException.class, () -> draft.cancel(" ", "alice"));
    }
}
