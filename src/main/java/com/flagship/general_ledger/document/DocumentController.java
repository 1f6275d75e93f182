package com.flagship.general_ledger.document;

import com.flagship.general_ledger.document.dto.CancelDocumentRequest;
import com.flagship.general_ledger.document.dto.DocumentCancellationResponse;
import com.flagship.general_ledger.document.dto.GenerateVoucherRequest;
import com.flagship.general_ledger.document.dto.LegalDocumentResponse;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryController;
import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Legal documents and the vouchers generated from them.
 */
@RestController
@RequestMapping("/api/legal-documents")
@RequiredArgsConstructor
public class DocumentController {

    private final LegalDocumentService documentService;
    private final DocumentVoucherBridge bridge;

    @PostMapping
    public ResponseEntity<LegalDocumentResponse> registerDocument(
            @Valid @RequestBody RegisterDocumentRequest request,
            @RequestHeader(JournalEntryController.ACTOR_HEADER) String actorId) {
        LegalDocument document = documentService.register(request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(LegalDocumentResponse.from(document));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LegalDocumentResponse> getDocument(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(LegalDocumentResponse.from(documentService.findById(id)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<LegalDocumentResponse> approveDocument(
            @PathVariable("id") UUID id,
            @RequestHeader(JournalEntryController.ACTOR_HEADER) String actorId) {
        return ResponseEntity.ok(LegalDocumentResponse.from(documentService.approve(id, actorId)));
    }

    @PostMapping("/{id}/vouchers")
    public ResponseEntity<JournalEntryResponse> generateVoucher(
            @PathVariable("id") UUID id,
            @Valid @RequestBody GenerateVoucherRequest request,
            @RequestHeader(JournalEntryController.ACTOR_HEADER) String actorId) {
        JournalEntry entry = bridge.generateVoucher(id, request.getVoucherTypeId(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<DocumentCancellationResponse> cancelDocument(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CancelDocumentRequest request,
            @RequestHeader(JournalEntryController.ACTOR_HEADER) String actorId) {
        DocumentCancellation cancellation = bridge.cancelDocument(id, request.getReason(), actorId);
        return ResponseEntity.ok(DocumentCancellationResponse.from(cancellation));
    }
}
