package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.chart.Account;
import com.flagship.general_ledger.chart.ChartOfAccountsGateway;
import com.flagship.general_ledger.exception.ConflictException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.general_ledger.journal.event.JournalEntryReversedEvent;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodGateway;
import com.flagship.general_ledger.sequence.NumberingScope;
import com.flagship.general_ledger.sequence.NumberingType;
import com.flagship.general_ledger.sequence.NumberingTypeRepository;
import com.flagship.general_ledger.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lifecycle of journal entries: create, update, post, reverse, delete.
 *
 * Key principles:
 * - Every operation is one transaction; header, lines, status history and outbox event commit together
 * - Existing entries are row-locked before any transition, so transitions of one entry serialize
 * - Validation runs in a fixed order: request shape, referenced rows, then ledger rules,
 *   and all rule violations of one request are reported together
 * - Posted lines are never modified; corrections go through a mirrored reversing entry
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryStore {

    private final JournalEntryRepository entries;
    private final SequenceAllocator sequenceAllocator;
    private final NumberingTypeRepository numberingTypes;
    private final ChartOfAccountsGateway chartOfAccounts;
    private final FiscalPeriodGateway fiscalPeriods;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Creates a DRAFT entry, allocating the number from the voucher type when none is supplied.
     *
     * @throws ValidationException for malformed or unbalanced lines, closed periods, non-postable accounts
     * @throws NotFoundException for an unknown voucher type, period or account
     * @throws ConflictException when a supplied number is already used for the voucher type
     * @throws ValidationException when a supplied number falls in the voucher type's allocated series
     */
    @Transactional
    public JournalEntry create(JournalEntryRequest request, String actorId) {
        return create(request, null, actorId);
    }

    /**
     * Same as {@link #create(JournalEntryRequest, String)}, linking the entry to the document it was generated from.
     */
    @Transactional
    public JournalEntry create(JournalEntryRequest request, SourceDocument source, String actorId) {
        return instrumented("create", null, () -> {
            requireWellFormed(request);
            NumberingType voucherType = numberingTypes.findById(NumberingScope.VOUCHER, request.getVoucherTypeId())
                .orElseThrow(() -> new NotFoundException(NumberingScope.VOUCHER.label(), request.getVoucherTypeId()));

            List<String> violations = new ArrayList<>();
            if (!voucherType.isActive()) {
                violations.add("Voucher type " + voucherType.getCode() + " is inactive");
            }
            checkPostingContext(request.getDate(), request.getFiscalPeriodId(), accountIdsOf(request), violations);
            if (!violations.isEmpty()) {
                throw ValidationException.of(violations);
            }

            String entryNumber = resolveEntryNumber(request);
            JournalEntry entry = JournalEntry.draft(UUID.randomUUID(), entryNumber, request, source, actorId);
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());

            entries.insert(entry);
            entries.recordStatusChange(entry, null, EntryStatus.DRAFT.name(), actorId,
                source != null ? "Generated from document " + source.getDocumentId() : null);

            log.info("Journal entry created: number={}, lines={}, debit={}, credit={}",
                entry.getEntryNumber(), entry.getLines().size(), entry.getTotalDebit(), entry.getTotalCredit());
            return entry;
        });
    }

    /**
     * Replaces header and lines of a DRAFT entry. Voucher type and number stay as they are.
     *
     * @throws com.flagship.general_ledger.exception.InvalidStateException if the entry is not a draft
     */
    @Transactional
    public JournalEntry update(UUID entryId, JournalEntryRequest request, String actorId) {
        return instrumented("update", entryId, () -> {
            JournalEntry current = lockEntry(entryId);
            current.ensureEditable("update");
            requireWellFormed(request);

            List<String> violations = new ArrayList<>();
            if (!current.getVoucherTypeId().equals(request.getVoucherTypeId())) {
                violations.add("Voucher type of an entry cannot be changed");
            }
            if (request.getEntryNumber() != null && !request.getEntryNumber().equals(current.getEntryNumber())) {
                violations.add("Entry number of an entry cannot be changed");
            }
            checkPostingContext(request.getDate(), request.getFiscalPeriodId(), accountIdsOf(request), violations);
            if (!violations.isEmpty()) {
                throw ValidationException.of(violations);
            }

            JournalEntry updated = current.withContent(request);
            entries.replaceContent(updated);

            log.info("Journal entry updated: number={}, lines={}", updated.getEntryNumber(), updated.getLines().size());
            return updated;
        });
    }

    /**
     * DRAFT -> POSTED. Balance, period and accounts are checked again against the stored entry.
     */
    @Transactional
    public JournalEntry post(UUID entryId, String actorId) {
        return instrumented("post", entryId, () -> {
            JournalEntry draft = lockEntry(entryId);
            JournalEntry posted = draft.post(actorId);

            List<String> violations = new ArrayList<>();
            checkPostingContext(draft.getDate(), draft.getFiscalPeriodId(), accountIdsOf(draft), violations);
            if (!violations.isEmpty()) {
                throw ValidationException.of(violations);
            }

            entries.updateStatus(posted);
            entries.recordStatusChange(posted, draft.getStatus(), posted.getStatus().name(), actorId, null);
            outboxService.saveEvent(OutboxService.JOURNAL_ENTRY, JournalEntryPostedEvent.fromEntry(posted));

            log.info("Journal entry posted: number={}, debit={}, credit={}",
                posted.getEntryNumber(), posted.getTotalDebit(), posted.getTotalCredit());
            return posted;
        });
    }

    /**
     * POSTED -> REVERSED by a mirrored entry of the same voucher type, posted in the same transaction.
     *
     * @param reversalDate date of the mirror; null keeps the original's date and period
     */
    @Transactional
    public Reversal reverse(UUID entryId, LocalDate reversalDate, String reason, String actorId) {
        return instrumented("reverse", entryId, () -> {
            JournalEntry original = lockEntry(entryId);
            UUID mirrorId = UUID.randomUUID();
            JournalEntry reversedOriginal = original.markReversed(mirrorId);

            LocalDate mirrorDate = reversalDate != null ? reversalDate : original.getDate();
            UUID mirrorPeriodId = reversalDate != null
                ? fiscalPeriods.findOpenContaining(reversalDate)
                    .map(FiscalPeriod::getId)
                    .orElseThrow(() -> new ValidationException("No open fiscal period contains " + reversalDate))
                : original.getFiscalPeriodId();

            List<String> violations = new ArrayList<>();
            checkPostingContext(mirrorDate, mirrorPeriodId, accountIdsOf(original), violations);
            if (!violations.isEmpty()) {
                throw ValidationException.of(violations);
            }

            String mirrorNumber = sequenceAllocator.nextVoucherNumber(original.getVoucherTypeId());
            JournalEntry mirrorDraft = original.mirror(mirrorId, mirrorNumber, mirrorDate, mirrorPeriodId, reason, actorId);
            entries.insert(mirrorDraft);
            entries.recordStatusChange(mirrorDraft, null, EntryStatus.DRAFT.name(), actorId,
                "Reversal of " + original.getEntryNumber());

            JournalEntry mirror = mirrorDraft.post(actorId);
            entries.updateStatus(mirror);
            entries.recordStatusChange(mirror, EntryStatus.DRAFT, mirror.getStatus().name(), actorId, null);

            entries.updateStatus(reversedOriginal);
            entries.recordStatusChange(reversedOriginal, original.getStatus(), reversedOriginal.getStatus().name(),
                actorId, reason);

            outboxService.saveEvent(OutboxService.JOURNAL_ENTRY, JournalEntryPostedEvent.fromEntry(mirror));
            outboxService.saveEvent(OutboxService.JOURNAL_ENTRY,
                JournalEntryReversedEvent.of(reversedOriginal, mirror, reason, actorId));

            log.info("Journal entry reversed: number={}, reversalNumber={}, reversalDate={}",
                original.getEntryNumber(), mirror.getEntryNumber(), mirrorDate);
            return new Reversal(reversedOriginal, mirror);
        });
    }

    /**
     * Removes a DRAFT entry with its lines. The status history keeps a DELETED row.
     */
    @Transactional
    public void delete(UUID entryId, String actorId) {
        instrumented("delete", entryId, () -> {
            JournalEntry draft = lockEntry(entryId);
            draft.ensureEditable("delete");

            entries.delete(entryId);
            entries.recordStatusChange(draft, draft.getStatus(), "DELETED", actorId, null);

            log.info("Journal entry deleted: number={}", draft.getEntryNumber());
            return null;
        });
    }

    /**
     * DRAFT -> CANCELLED for an entry the caller has already locked, as part of a document cancellation.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry cancel(JournalEntry lockedDraft, String reason, String actorId) {
        return instrumented("cancel", lockedDraft.getId(), () -> {
            JournalEntry cancelled = lockedDraft.cancel(reason);
            entries.updateStatus(cancelled);
            entries.recordStatusChange(cancelled, lockedDraft.getStatus(), cancelled.getStatus().name(), actorId, reason);

            log.info("Journal entry cancelled: number={}", cancelled.getEntryNumber());
            return cancelled;
        });
    }

    @Transactional(readOnly = true)
    public JournalEntry findById(UUID entryId) {
        return entries.findById(entryId)
            .orElseThrow(() -> new NotFoundException("Journal entry", entryId));
    }

    @Transactional(readOnly = true)
    public List<StatusChange> findStatusHistory(UUID entryId) {
        return entries.findStatusHistory(entryId);
    }

    private JournalEntry lockEntry(UUID entryId) {
        return entries.lockById(entryId)
            .orElseThrow(() -> new NotFoundException("Journal entry", entryId));
    }

    private static void requireWellFormed(JournalEntryRequest request) {
        List<String> violations = request.validate();
        if (!violations.isEmpty()) {
            throw ValidationException.of(violations);
        }
    }

    private String resolveEntryNumber(JournalEntryRequest request) {
        String supplied = request.getEntryNumber();
        if (supplied == null || supplied.isBlank()) {
            return sequenceAllocator.nextVoucherNumber(request.getVoucherTypeId());
        }
        sequenceAllocator.reserveSuppliedVoucherNumber(request.getVoucherTypeId(), supplied);
        if (entries.existsByNumber(request.getVoucherTypeId(), supplied)) {
            throw new ConflictException("Entry number " + supplied + " is already used for this voucher type",
                Map.of("entry_number", supplied, "voucher_type_id", request.getVoucherTypeId().toString()));
        }
        return supplied;
    }

    /**
     * Period must exist, be open and contain the date; accounts must exist and accept entries.
     * Missing rows throw NotFoundException, rule breaks are added to violations.
     */
    private void checkPostingContext(LocalDate date, UUID fiscalPeriodId, Set<UUID> accountIds, List<String> violations) {
        FiscalPeriod period = fiscalPeriods.findById(fiscalPeriodId)
            .orElseThrow(() -> new NotFoundException("Fiscal period", fiscalPeriodId));
        if (period.isClosed()) {
            violations.add("Fiscal period " + period.getName() + " is closed");
        } else if (!period.contains(date)) {
            violations.add(String.format("Entry date %s is outside fiscal period %s (%s to %s)",
                date, period.getName(), period.getStartDate(), period.getEndDate()));
        }

        Map<UUID, Account> accounts = chartOfAccounts.findAllById(accountIds);
        for (UUID accountId : accountIds) {
            Account account = accounts.get(accountId);
            if (account == null) {
                throw new NotFoundException("Account", accountId);
            }
            if (!account.isActive()) {
                violations.add("Account " + account.getCode() + " is inactive");
            } else if (!account.isAllowsEntries()) {
                violations.add("Account " + account.getCode() + " does not allow entries");
            }
        }
    }

    private static Set<UUID> accountIdsOf(JournalEntryRequest request) {
        Set<UUID> ids = new LinkedHashSet<>();
        request.getLines().forEach(line -> ids.add(line.getAccountId()));
        return ids;
    }

    private static Set<UUID> accountIdsOf(JournalEntry entry) {
        Set<UUID> ids = new LinkedHashSet<>();
        entry.getLines().forEach(line -> ids.add(line.getAccountId()));
        return ids;
    }

    /**
     * Runs one operation with the entry id in MDC, counting its outcome and latency.
     * Failures are logged and rethrown so the transaction rolls back.
     */
    private <T> T instrumented(String operation, UUID entryId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        String previousEntryId = MDC.get(CorrelationContext.ENTRY_ID_MDC_KEY);
        if (entryId != null) {
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        }
        try {
            T result = action.get();
            ledgerMetrics.recordEntryOperation(operation, "success");
            return result;
        } catch (ValidationException | NotFoundException | ConflictException | IllegalStateException e) {
            ledgerMetrics.recordEntryOperation(operation, LedgerMetrics.outcomeOf(e));
            log.warn("Journal entry {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordEntryOperation(operation, "error");
            log.error("Journal entry {} failed: {}", operation, e.getMessage(), e);
            throw e;
        } finally {
            ledgerMetrics.recordLatency("entry_" + operation, System.currentTimeMillis() - startTime);
            if (previousEntryId != null) {
                MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, previousEntryId);
            } else {
                MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
            }
        }
    }
}
