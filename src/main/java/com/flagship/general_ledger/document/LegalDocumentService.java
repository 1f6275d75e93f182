package com.flagship.general_ledger.document;

import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodGateway;
import com.flagship.general_ledger.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Register, approve and read legal documents. Cancellation goes through
 * {@link DocumentVoucherBridge} because it cascades to the document's vouchers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LegalDocumentService {

    private final LegalDocumentRepository repository;
    private final SequenceAllocator sequenceAllocator;
    private final FiscalPeriodGateway fiscalPeriods;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Registers a DRAFT document numbered from its document type.
     */
    @Transactional
    public LegalDocument register(RegisterDocumentRequest request, String actorId) {
        FiscalPeriod period = fiscalPeriods.findById(request.getFiscalPeriodId())
            .orElseThrow(() -> new NotFoundException("Fiscal period", request.getFiscalPeriodId()));
        if (!period.contains(request.getDate())) {
            throw new ValidationException(String.format("Document date %s is outside fiscal period %s",
                request.getDate(), period.getName()));
        }

        String number = sequenceAllocator.nextDocumentNumber(request.getDocumentTypeId());
        LegalDocument document = LegalDocument.register(UUID.randomUUID(), number, request, actorId);
        LegalDocument saved = repository.saveAndFlush(LegalDocumentEntity.fromDomain(document)).toDomain();

        ledgerMetrics.recordDocumentOperation("register", "success");
        log.info("Legal document registered: number={}, total={} {}",
            saved.getDocumentNumber(), saved.getTotalAmount(), saved.getCurrency());
        return saved;
    }

    @Transactional
    public LegalDocument approve(UUID documentId, String actorId) {
        LegalDocumentEntity entity = lockEntity(documentId);
        LegalDocument approved = entity.toDomain().approve(actorId);
        entity.updateFromDomain(approved);
        repository.save(entity);

        ledgerMetrics.recordDocumentOperation("approve", "success");
        log.info("Legal document approved: number={}", approved.getDocumentNumber());
        return approved;
    }

    @Transactional(readOnly = true)
    public LegalDocument findById(UUID documentId) {
        return repository.findById(documentId)
            .map(LegalDocumentEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Legal document", documentId));
    }

    /**
     * Locks the document row for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LegalDocument lock(UUID documentId) {
        return lockEntity(documentId).toDomain();
    }

    /**
     * Persists a transition of a document the caller has locked.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LegalDocument saveTransition(LegalDocument document) {
        LegalDocumentEntity entity = repository.findById(document.getId())
            .orElseThrow(() -> new NotFoundException("Legal document", document.getId()));
        entity.updateFromDomain(document);
        return repository.save(entity).toDomain();
    }

    private LegalDocumentEntity lockEntity(UUID documentId) {
        return repository.findByIdForUpdate(documentId)
            .orElseThrow(() -> new NotFoundException("Legal document", documentId));
    }
}
