package com.flagship.general_ledger.document;

import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.JournalEntryRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds voucher lines from the document_posting_rules table:
 * debit the document total; credit the subtotal and the tax separately when the rule
 * has a tax account and the document carries tax, otherwise credit the total.
 *
 * Lowest precedence, so a more specific builder can take over for some document types.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public class PostingRuleLineBuilder implements VoucherLineBuilder {

    private final PostingRuleRepository postingRules;

    @Override
    public boolean supports(LegalDocument document, UUID voucherTypeId) {
        return postingRules.find(document.getDocumentTypeId(), voucherTypeId).isPresent();
    }

    @Override
    public VoucherDraft build(LegalDocument document, UUID voucherTypeId) {
        PostingRule rule = postingRules.find(document.getDocumentTypeId(), voucherTypeId)
            .orElseThrow(() -> new ValidationException(
                "No posting rule for document " + document.getDocumentNumber() + " and voucher type " + voucherTypeId));

        String description = "Document " + document.getDocumentNumber();
        List<JournalEntryRequest.Line> lines = new ArrayList<>();
        lines.add(JournalEntryRequest.Line.debit(rule.getDebitAccountId(), document.getTotalAmount(), description));

        boolean splitTax = rule.getTaxAccountId() != null && document.getTaxAmount().signum() > 0;
        if (splitTax) {
            if (document.getSubtotal().signum() > 0) {
                lines.add(JournalEntryRequest.Line.credit(rule.getCreditAccountId(), document.getSubtotal(), description));
            }
            lines.add(JournalEntryRequest.Line.credit(rule.getTaxAccountId(), document.getTaxAmount(), description + " tax"));
        } else {
            lines.add(JournalEntryRequest.Line.credit(rule.getCreditAccountId(), document.getTotalAmount(), description));
        }
        return new VoucherDraft(description, List.copyOf(lines), rule.isPostImmediately());
    }
}
