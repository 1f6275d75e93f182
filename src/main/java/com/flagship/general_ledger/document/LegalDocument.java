package com.flagship.general_ledger.document;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Legal document that vouchers are generated from.
 *
 * Transitions return new instances; invalid ones throw {@link InvalidStateException}.
 */
@Value
@Builder(toBuilder = true)
public class LegalDocument {
    UUID id;
    UUID documentTypeId;
    String documentNumber;
    LocalDate date;
    String reference;
    String description;
    UUID thirdPartyId;
    DocumentStatus status;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    String currency;
    BigDecimal exchangeRate;
    UUID fiscalPeriodId;
    String approvedBy;
    Instant approvedAt;
    String cancellationReason;
    String cancelledBy;
    Instant cancelledAt;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public static LegalDocument register(UUID id, String documentNumber, RegisterDocumentRequest request, String actorId) {
        BigDecimal subtotal = toMoney(request.getSubtotal());
        BigDecimal tax = toMoney(request.taxOrZero());
        return LegalDocument.builder()
            .id(id)
            .documentTypeId(request.getDocumentTypeId())
            .documentNumber(documentNumber)
            .date(request.getDate())
            .reference(request.getReference())
            .description(request.getDescription())
            .thirdPartyId(request.getThirdPartyId())
            .status(DocumentStatus.DRAFT)
            .subtotal(subtotal)
            .taxAmount(tax)
            .totalAmount(subtotal.add(tax))
            .currency(request.getCurrency())
            .exchangeRate(request.getExchangeRate() != null ? request.getExchangeRate() : BigDecimal.ONE)
            .fiscalPeriodId(request.getFiscalPeriodId())
            .createdBy(actorId)
            .build();
    }

    public LegalDocument approve(String actorId) {
        requireTransition(DocumentStatus.APPROVED, "approve");
        return toBuilder()
            .status(DocumentStatus.APPROVED)
            .approvedBy(actorId)
            .approvedAt(Instant.now())
            .build();
    }

    /**
     * @throws ValidationException if the reason is blank
     * @throws InvalidStateException if already cancelled
     */
    public LegalDocument cancel(String reason, String actorId) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Cancellation reason is required");
        }
        requireTransition(DocumentStatus.CANCELLED, "cancel");
        return toBuilder()
            .status(DocumentStatus.CANCELLED)
            .cancellationReason(reason)
            .cancelledBy(actorId)
            .cancelledAt(Instant.now())
            .build();
    }

    public boolean isApproved() {
        return status == DocumentStatus.APPROVED;
    }

    private void requireTransition(DocumentStatus target, String operation) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot %s document %s in %s status.", operation, documentNumber, status));
        }
    }

    private static BigDecimal toMoney(BigDecimal amount) {
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("Document amounts allow at most 2 decimal places: " + amount);
        }
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }
}
