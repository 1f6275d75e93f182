package com.flagship.general_ledger.document;

import lombok.Value;

import java.util.UUID;

/**
 * Accounts a document type posts to under one voucher type.
 * taxAccountId is optional; without it the document total goes to the credit account.
 */
@Value
public class PostingRule {
    UUID id;
    UUID documentTypeId;
    UUID voucherTypeId;
    UUID debitAccountId;
    UUID creditAccountId;
    UUID taxAccountId;
    boolean postImmediately;
}
