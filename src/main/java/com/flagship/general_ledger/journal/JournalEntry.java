package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Journal entry ("voucher"): a header and its balanced debit/credit lines.
 *
 * Key principles:
 * - Status transitions go through {@link EntryStatus#canTransitionTo} and are rejected otherwise
 * - totalDebit/totalCredit are derived from the lines, never set independently
 * - Each transition returns a new instance; the stored row is updated by the store
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    String entryNumber;
    UUID voucherTypeId;
    LocalDate date;
    String reference;
    String description;
    String currency;
    BigDecimal exchangeRate;
    UUID fiscalPeriodId;
    UUID thirdPartyId;
    EntryStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    UUID documentTypeId;
    UUID documentId;
    UUID reversalOfId;
    UUID reversedById;
    String cancellationReason;
    String createdBy;
    Instant createdAt;
    String postedBy;
    Instant postedAt;
    List<JournalLine> lines;

    /**
     * Creates a DRAFT entry from a validated request.
     * Lines are numbered 1..n in request order; a line without a third party inherits the header's.
     */
    public static JournalEntry draft(UUID id, String entryNumber, JournalEntryRequest request,
                                     SourceDocument source, String actorId) {
        List<JournalLine> lines = numberLines(request);
        return JournalEntry.builder()
            .id(id)
            .entryNumber(entryNumber)
            .voucherTypeId(request.getVoucherTypeId())
            .date(request.getDate())
            .reference(request.getReference())
            .description(request.getDescription())
            .currency(request.getCurrency())
            .exchangeRate(request.effectiveExchangeRate())
            .fiscalPeriodId(request.getFiscalPeriodId())
            .thirdPartyId(request.getThirdPartyId())
            .status(EntryStatus.DRAFT)
            .totalDebit(sumDebits(lines))
            .totalCredit(sumCredits(lines))
            .documentTypeId(source != null ? source.getDocumentTypeId() : null)
            .documentId(source != null ? source.getDocumentId() : null)
            .createdBy(actorId)
            .createdAt(Instant.now())
            .lines(lines)
            .build();
    }

    /**
     * Replaces header fields and the full line set of a DRAFT entry.
     * Number, voucher type and source document do not change.
     */
    public JournalEntry withContent(JournalEntryRequest request) {
        ensureEditable("update");
        List<JournalLine> newLines = numberLines(request);
        return toBuilder()
            .date(request.getDate())
            .reference(request.getReference())
            .description(request.getDescription())
            .currency(request.getCurrency())
            .exchangeRate(request.effectiveExchangeRate())
            .fiscalPeriodId(request.getFiscalPeriodId())
            .thirdPartyId(request.getThirdPartyId())
            .totalDebit(sumDebits(newLines))
            .totalCredit(sumCredits(newLines))
            .lines(newLines)
            .build();
    }

    /**
     * DRAFT -> POSTED. Balance is checked again from the stored lines.
     *
     * @throws InvalidStateException if the entry is not a draft
     * @throws ValidationException if the lines do not balance
     */
    public JournalEntry post(String actorId) {
        requireTransition(EntryStatus.POSTED, "post");
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("Entry " + entryNumber + " has no lines");
        }
        if (!isBalanced()) {
            throw new ValidationException(String.format(
                "Entry %s is not balanced: debits=%s, credits=%s, difference=%s",
                entryNumber, sumDebits(lines), sumCredits(lines), getDifference().abs()));
        }
        return toBuilder()
            .status(EntryStatus.POSTED)
            .postedBy(actorId)
            .postedAt(Instant.now())
            .build();
    }

    /**
     * POSTED -> REVERSED, linked to the mirrored entry that offsets it.
     *
     * @throws InvalidStateException if not posted, or if this entry is itself a reversal
     */
    public JournalEntry markReversed(UUID reversalEntryId) {
        if (isReversal()) {
            throw new InvalidStateException(String.format(
                "Entry %s reverses entry %s and cannot be reversed itself", entryNumber, reversalOfId));
        }
        requireTransition(EntryStatus.REVERSED, "reverse");
        return toBuilder()
            .status(EntryStatus.REVERSED)
            .reversedById(reversalEntryId)
            .build();
    }

    /**
     * DRAFT -> CANCELLED, when the source document is cancelled.
     */
    public JournalEntry cancel(String reason) {
        requireTransition(EntryStatus.CANCELLED, "cancel");
        return toBuilder()
            .status(EntryStatus.CANCELLED)
            .cancellationReason(reason)
            .build();
    }

    /**
     * Builds the DRAFT reversing entry: same voucher type and accounts, debit and credit swapped.
     * The store posts it in the same transaction that flags this entry REVERSED.
     */
    public JournalEntry mirror(UUID mirrorId, String mirrorNumber, LocalDate mirrorDate,
                               UUID mirrorPeriodId, String reason, String actorId) {
        List<JournalLine> mirroredLines = new ArrayList<>();
        for (JournalLine line : lines) {
            mirroredLines.add(line.mirrored(UUID.randomUUID(), "Reversal: " + nullToEmpty(line.getDescription())));
        }
        String mirrorDescription = reason == null || reason.isBlank()
            ? "Reversal of " + entryNumber
            : "Reversal of " + entryNumber + ": " + reason;

        return toBuilder()
            .id(mirrorId)
            .entryNumber(mirrorNumber)
            .date(mirrorDate)
            .fiscalPeriodId(mirrorPeriodId)
            .description(mirrorDescription)
            .status(EntryStatus.DRAFT)
            .totalDebit(sumDebits(mirroredLines))
            .totalCredit(sumCredits(mirroredLines))
            .documentTypeId(null)
            .documentId(null)
            .reversalOfId(id)
            .reversedById(null)
            .cancellationReason(null)
            .createdBy(actorId)
            .createdAt(Instant.now())
            .postedBy(null)
            .postedAt(null)
            .lines(List.copyOf(mirroredLines))
            .build();
    }

    public void ensureEditable(String operation) {
        if (!status.isEditable()) {
            throw new InvalidStateException(String.format(
                "Cannot %s entry %s in %s status. Only DRAFT entries can be modified.",
                operation, entryNumber, status));
        }
    }

    public boolean isReversal() {
        return reversalOfId != null;
    }

    /**
     * debits - credits over the current lines
     */
    public BigDecimal getDifference() {
        return sumDebits(lines).subtract(sumCredits(lines));
    }

    public boolean isBalanced() {
        return getDifference().abs().compareTo(JournalEntryRequest.BALANCE_TOLERANCE) < 0;
    }

    public boolean canTransitionTo(EntryStatus target) {
        return status.canTransitionTo(target);
    }

    private void requireTransition(EntryStatus target, String operation) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot %s entry %s in %s status.", operation, entryNumber, status));
        }
    }

    private static List<JournalLine> numberLines(JournalEntryRequest request) {
        List<JournalLine> numbered = new ArrayList<>();
        int order = 1;
        for (JournalEntryRequest.Line line : request.getLines()) {
            numbered.add(new JournalLine(
                UUID.randomUUID(),
                order++,
                line.getAccountId(),
                line.getDescription(),
                toMoney(line.debitOrZero()),
                toMoney(line.creditOrZero()),
                line.getThirdPartyId() != null ? line.getThirdPartyId() : request.getThirdPartyId()
            ));
        }
        return List.copyOf(numbered);
    }

    // Requests are validated first, so more than two decimals never reach this point
    private static BigDecimal toMoney(BigDecimal amount) {
        return amount.setScale(JournalEntryRequest.MONEY_SCALE, RoundingMode.UNNECESSARY);
    }

    private static BigDecimal sumDebits(List<JournalLine> lines) {
        return lines.stream()
            .map(JournalLine::getDebitAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(JournalEntryRequest.MONEY_SCALE, RoundingMode.UNNECESSARY);
    }

    private static BigDecimal sumCredits(List<JournalLine> lines) {
        return lines.stream()
            .map(JournalLine::getCreditAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(JournalEntryRequest.MONEY_SCALE, RoundingMode.UNNECESSARY);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
