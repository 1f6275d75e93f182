package com.flagship.general_ledger.document;

import java.util.UUID;

/**
 * Maps a legal document to the lines of the voucher generated from it.
 *
 * Implementations are Spring beans; the first one, in {@link org.springframework.core.annotation.Order}
 * order, that supports a document and voucher type is used.
 */
public interface VoucherLineBuilder {

    boolean supports(LegalDocument document, UUID voucherTypeId);

    VoucherDraft build(LegalDocument document, UUID voucherTypeId);
}
