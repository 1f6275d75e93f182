package com.flagship.general_ledger.journal;

import lombok.Value;

import java.util.UUID;

/**
 * Legal document a voucher was generated from.
 */
@Value
public class SourceDocument {
    UUID documentTypeId;
    UUID documentId;
}
