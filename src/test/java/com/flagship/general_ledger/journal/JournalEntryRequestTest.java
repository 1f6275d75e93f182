package com.flagship.general_ledger.journal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryRequestTest {

    private final UUID cash = UUID.randomUUID();
    private final UUID revenue = UUID.randomUUID();

    private JournalEntryRequest request(List<JournalEntryRequest.Line> lines) {
        return JournalEntryRequest.builder()
            .voucherTypeId(UUID.randomUUID())
            .date(LocalDate.of(2024, 1, 5))
            .currency("USD")
            .fiscalPeriodId(UUID.randomUUID())
            .lines(lines)
            .build();
    }

    @Test
    @DisplayName("Balanced request has no violations")
    void balancedRequestIsValid() {
        JournalEntryRequest request = request(List.of(
            JournalEntryRequest.Line.debit(cash, new BigDecimal("100.00"), "cash"),
            JournalEntryRequest.Line.credit(revenue, new BigDecimal("100.00"), "sale")));

        assertTrue(request.validate().isEmpty());
        assertTrue(request.isBalanced());
        assertEquals(0, new BigDecimal("100.00").compareTo(request.getDebitTotal()));
    }

    @Test
    @DisplayName("Debits 50 against credits 40 are rejected with a difference of 10")
    void unbalancedRequestReportsDifference() {
        JournalEntryRequest request = request(List.of(
            JournalEntryRequest.Line.debit(cash, new BigDecimal("50"), "cash"),
            JournalEntryRequest.Line.credit(revenue, new BigDecimal("40"), "sale")));

        List<String> violations = request.validate();

        assertFalse(request.isBalanced());
        assertEquals(0, BigDecimal.TEN.compareTo(request.getDifference()));
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("difference=10"), violations.get(0));
    }

    @Test
    @DisplayName("Difference below one cent counts as balanced")
    void subCentDifferenceIsTolerated() {
        JournalEntryRequest request = request(List.of(
            JournalEntryRequest.Line.debit(cash, new BigDecimal("10.00"), "cash"),
            JournalEntryRequest.Line.credit(revenue, new BigDecimal("9.995"), "sale")));

        assertTrue(request.isBalanced());
    }

    @Test
    @DisplayName("Every malformed line is reported, numbered from one")
    void malformedLinesAreCollected() {
        JournalEntryRequest request = request(List.of(
            JournalEntryRequest.Line.builder().accountId(cash)
                .debitAmount(new BigDecimal("5")).creditAmount(new BigDecimal("5")).build(),
            JournalEntryRequest.Line.builder().accountId(revenue).build(),
            JournalEntryRequest.Line.debit(null, new BigDecimal("-1"), "negative"),
            JournalEntryRequest.Line.credit(revenue, new BigDecimal("1.001"), "precise")));

        List<String> violations = request.validate();

        assertTrue(violations.contains("Line 1: a line carries either a debit or a credit, not both"));
        assertTrue(violations.contains("Line 2: a debit or credit amount is required"));
        assertTrue(violations.contains("Line 3: account is required"));
        assertTrue(violations.contains("Line 3: amounts cannot be negative"));
        assertTrue(violations.contains("Line 4: amounts allow at most 2 decimal places"));
    }

    @Test
    @DisplayName("A null element in the line list is reported at its position")
    void nullLineIsReported() {
        JournalEntryRequest request = request(Arrays.asList(
            JournalEntryRequest.Line.debit(cash, new BigDecimal("10.00"), "cash"),
            null,
            JournalEntryRequest.Line.credit(revenue, new BigDecimal("10.00"), "sale")));

        List<String> violations = request.validate();

        assertEquals(List.of("Line 2: line is required"), violations);
    }

    @Test
    @DisplayName("Missing header fields and lines are reported together")
    void missingHeaderFields() {
        JournalEntryRequest request = JournalEntryRequest.builder().currency("usd").build();

        List<String> violations = request.validate();

        assertTrue(violations.contains("Voucher type is required"));
        assertTrue(violations.contains("Entry date is required"));
        assertTrue(violations.contains("Fiscal period is required"));
        assertTrue(violations.contains("Currency must be a 3-letter ISO code"));
        assertTrue(violations.contains("Entry must have at least one line"));
    }
}
