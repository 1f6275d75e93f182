package com.flagship.general_ledger.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of legal_documents.
 *
 * No setters: header fields are fixed at registration, and only the lifecycle
 * columns change through {@link #updateFromDomain(LegalDocument)}.
 */
@Entity
@Table(name = "legal_documents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LegalDocumentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "document_type_id", nullable = false, updatable = false)
    private UUID documentTypeId;

    @Column(name = "document_number", nullable = false, updatable = false, length = 40)
    private String documentNumber;

    @Column(name = "document_date", nullable = false, updatable = false)
    private LocalDate documentDate;

    @Column(name = "reference", updatable = false, length = 100)
    private String reference;

    @Column(name = "description", updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "third_party_id", updatable = false)
    private UUID thirdPartyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentStatus status;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "exchange_rate", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal exchangeRate;

    @Column(name = "fiscal_period_id", nullable = false, updatable = false)
    private UUID fiscalPeriodId;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "cancelled_by", length = 100)
    private String cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LegalDocumentEntity fromDomain(LegalDocument document) {
        return new LegalDocumentEntity(
            document.getId(),
            document.getDocumentTypeId(),
            document.getDocumentNumber(),
            document.getDate(),
            document.getReference(),
            document.getDescription(),
            document.getThirdPartyId(),
            document.getStatus(),
            document.getSubtotal(),
            document.getTaxAmount(),
            document.getTotalAmount(),
            document.getCurrency(),
            document.getExchangeRate(),
            document.getFiscalPeriodId(),
            document.getApprovedBy(),
            document.getApprovedAt(),
            document.getCancellationReason(),
            document.getCancelledBy(),
            document.getCancelledAt(),
            document.getCreatedBy(),
            null, // createdAt, set by @PrePersist
            null  // updatedAt, set by @PrePersist
        );
    }

    public LegalDocument toDomain() {
        return LegalDocument.builder()
            .id(id)
            .documentTypeId(documentTypeId)
            .documentNumber(documentNumber)
            .date(documentDate)
            .reference(reference)
            .description(description)
            .thirdPartyId(thirdPartyId)
            .status(status)
            .subtotal(subtotal)
            .taxAmount(taxAmount)
            .totalAmount(totalAmount)
            .currency(currency)
            .exchangeRate(exchangeRate)
            .fiscalPeriodId(fiscalPeriodId)
            .approvedBy(approvedBy)
            .approvedAt(approvedAt)
            .cancellationReason(cancellationReason)
            .cancelledBy(cancelledBy)
            .cancelledAt(cancelledAt)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the lifecycle columns. Everything else is immutable after registration.
     */
    void updateFromDomain(LegalDocument document) {
        this.status = document.getStatus();
        this.approvedBy = document.getApprovedBy();
        this.approvedAt = document.getApprovedAt();
        this.cancellationReason = document.getCancellationReason();
        this.cancelledBy = document.getCancelledBy();
        this.cancelledAt = document.getCancelledAt();
    }
}
