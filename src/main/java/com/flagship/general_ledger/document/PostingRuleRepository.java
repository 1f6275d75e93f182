package com.flagship.general_ledger.document;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PostingRuleRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public Optional<PostingRule> find(UUID documentTypeId, UUID voucherTypeId) {
        return jdbcTemplate.query("""
                SELECT id, document_type_id, voucher_type_id, debit_account_id, credit_account_id,
                       tax_account_id, post_immediately
                FROM document_posting_rules
                WHERE document_type_id = :documentTypeId AND voucher_type_id = :voucherTypeId
                """,
                Map.of("documentTypeId", documentTypeId, "voucherTypeId", voucherTypeId),
                (rs, rowNum) -> new PostingRule(
                    rs.getObject("id", UUID.class),
                    rs.getObject("document_type_id", UUID.class),
                    rs.getObject("voucher_type_id", UUID.class),
                    rs.getObject("debit_account_id", UUID.class),
                    rs.getObject("credit_account_id", UUID.class),
                    rs.getObject("tax_account_id", UUID.class),
                    rs.getBoolean("post_immediately")))
            .stream()
            .findFirst();
    }

    public void save(PostingRule rule) {
        jdbcTemplate.update("""
            INSERT INTO document_posting_rules
                (id, document_type_id, voucher_type_id, debit_account_id, credit_account_id, tax_account_id, post_immediately)
            VALUES (:id, :documentTypeId, :voucherTypeId, :debitAccountId, :creditAccountId, :taxAccountId, :postImmediately)
            ON CONFLICT (document_type_id, voucher_type_id) DO UPDATE
            SET debit_account_id = EXCLUDED.debit_account_id,
                credit_account_id = EXCLUDED.credit_account_id,
                tax_account_id = EXCLUDED.tax_account_id,
                post_immediately = EXCLUDED.post_immediately
            """,
            new MapSqlParameterSource()
                .addValue("id", rule.getId())
                .addValue("documentTypeId", rule.getDocumentTypeId())
                .addValue("voucherTypeId", rule.getVoucherTypeId())
                .addValue("debitAccountId", rule.getDebitAccountId())
                .addValue("creditAccountId", rule.getCreditAccountId())
                .addValue("taxAccountId", rule.getTaxAccountId())
                .addValue("postImmediately", rule.isPostImmediately()));
    }
}
