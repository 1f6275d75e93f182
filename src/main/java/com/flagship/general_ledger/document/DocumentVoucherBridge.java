package com.flagship.general_ledger.document;

import com.flagship.general_ledger.document.event.LegalDocumentCancelledEvent;
import com.flagship.general_ledger.exception.ConflictException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.EntryStatus;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryRepository;
import com.flagship.general_ledger.journal.JournalEntryRequest;
import com.flagship.general_ledger.journal.JournalEntryStore;
import com.flagship.general_ledger.journal.SourceDocument;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Keeps legal documents and the vouchers generated from them consistent, in both directions.
 *
 * Lock order is always the document row first, then its entries by id. An entry being
 * posted while its document is cancelled therefore either commits first (the cancel then
 * fails with a conflict) or waits for the cancel and finds its entry CANCELLED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentVoucherBridge {

    private final LegalDocumentService documents;
    private final JournalEntryStore store;
    private final JournalEntryRepository entries;
    private final List<VoucherLineBuilder> lineBuilders;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Generates, and posts when the rule says so, the voucher of an APPROVED document.
     *
     * @throws NotFoundException if the document does not exist
     * @throws InvalidStateException if the document is not APPROVED
     * @throws ConflictException if the document already has a voucher of this type
     * @throws ValidationException if no line builder supports the document
     */
    @Transactional
    public JournalEntry generateVoucher(UUID documentId, UUID voucherTypeId, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DOCUMENT_ID_MDC_KEY, documentId.toString());
        log.info("Generating voucher from document: voucherType={}", voucherTypeId);

        try {
            LegalDocument document = documents.lock(documentId);
            if (!document.isApproved()) {
                throw new InvalidStateException(String.format(
                    "Document %s is %s; only APPROVED documents generate vouchers",
                    document.getDocumentNumber(), document.getStatus()));
            }

            entries.findByDocumentAndVoucherType(documentId, voucherTypeId).ifPresent(existing -> {
                throw new ConflictException(
                    "Document " + document.getDocumentNumber() + " already has voucher " + existing.getEntryNumber(),
                    Map.of("entry_id", existing.getId().toString(), "entry_number", existing.getEntryNumber()));
            });

            VoucherLineBuilder builder = lineBuilders.stream()
                .filter(candidate -> candidate.supports(document, voucherTypeId))
                .findFirst()
                .orElseThrow(() -> new ValidationException(String.format(
                    "No voucher line builder supports document %s with voucher type %s",
                    document.getDocumentNumber(), voucherTypeId)));
            VoucherDraft draft = builder.build(document, voucherTypeId);

            JournalEntryRequest request = JournalEntryRequest.builder()
                .voucherTypeId(voucherTypeId)
                .date(document.getDate())
                .reference(document.getReference() != null ? document.getReference() : document.getDocumentNumber())
                .description(draft.getDescription())
                .currency(document.getCurrency())
                .exchangeRate(document.getExchangeRate())
                .fiscalPeriodId(document.getFiscalPeriodId())
                .thirdPartyId(document.getThirdPartyId())
                .lines(draft.getLines())
                .build();

            JournalEntry entry = store.create(request,
                new SourceDocument(document.getDocumentTypeId(), document.getId()), actorId);
            if (draft.isPostImmediately()) {
                entry = store.post(entry.getId(), actorId);
            }

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordDocumentOperation("generate_voucher", "success");
            ledgerMetrics.recordLatency("generate_voucher", duration);
            log.info("Voucher generated: document={}, entry={}, status={}, duration={}ms",
                document.getDocumentNumber(), entry.getEntryNumber(), entry.getStatus(), duration);
            return entry;

        } catch (RuntimeException e) {
            ledgerMetrics.recordDocumentOperation("generate_voucher", LedgerMetrics.outcomeOf(e));
            ledgerMetrics.recordLatency("generate_voucher", System.currentTimeMillis() - startTime);
            log.warn("Voucher generation failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DOCUMENT_ID_MDC_KEY);
        }
    }

    /**
     * Cancels a document and the draft vouchers generated from it.
     * REVERSED and CANCELLED vouchers are left as they are; a POSTED voucher blocks the cancellation
     * until it is reversed.
     *
     * @throws ValidationException if the reason is blank
     * @throws InvalidStateException if the document is already cancelled
     * @throws ConflictException listing the POSTED vouchers that block the cancellation
     */
    @Transactional
    public DocumentCancellation cancelDocument(UUID documentId, String reason, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DOCUMENT_ID_MDC_KEY, documentId.toString());
        log.info("Cancelling document");

        try {
            if (reason == null || reason.isBlank()) {
                throw new ValidationException("Cancellation reason is required");
            }

            LegalDocument document = documents.lock(documentId);
            LegalDocument cancelled = document.cancel(reason, actorId);

            List<JournalEntry> linked = entries.lockByDocumentId(documentId);
            List<JournalEntry> blocking = linked.stream()
                .filter(entry -> entry.getStatus() == EntryStatus.POSTED)
                .toList();
            if (!blocking.isEmpty()) {
                throw new ConflictException(
                    "Document " + document.getDocumentNumber() + " has posted vouchers; reverse them before cancelling",
                    blockingDetails(blocking));
            }

            String note = "Cancelled with document " + document.getDocumentNumber() + ": " + reason;
            List<JournalEntry> cancelledEntries = new ArrayList<>();
            for (JournalEntry entry : linked) {
                if (entry.getStatus() == EntryStatus.DRAFT) {
                    cancelledEntries.add(store.cancel(entry, note, actorId));
                }
            }

            LegalDocument saved = documents.saveTransition(cancelled);
            outboxService.saveEvent(OutboxService.LEGAL_DOCUMENT, LegalDocumentCancelledEvent.of(saved,
                cancelledEntries.stream().map(JournalEntry::getId).toList()));

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordDocumentOperation("cancel", "success");
            ledgerMetrics.recordLatency("cancel_document", duration);
            log.info("Document cancelled: number={}, cancelledEntries={}, untouchedEntries={}, duration={}ms",
                saved.getDocumentNumber(), cancelledEntries.size(), linked.size() - cancelledEntries.size(), duration);
            return new DocumentCancellation(saved, List.copyOf(cancelledEntries));

        } catch (RuntimeException e) {
            ledgerMetrics.recordDocumentOperation("cancel", LedgerMetrics.outcomeOf(e));
            ledgerMetrics.recordLatency("cancel_document", System.currentTimeMillis() - startTime);
            log.warn("Document cancellation failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DOCUMENT_ID_MDC_KEY);
        }
    }

    private static Map<String, String> blockingDetails(List<JournalEntry> blocking) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("blocking_entry_ids", blocking.stream()
            .map(entry -> entry.getId().toString())
            .collect(Collectors.joining(",")));
        details.put("blocking_entry_numbers", blocking.stream()
            .map(JournalEntry::getEntryNumber)
            .collect(Collectors.joining(",")));
        return details;
    }
}
