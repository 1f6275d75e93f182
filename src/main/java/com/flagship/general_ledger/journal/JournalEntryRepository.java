package com.flagship.general_ledger.journal;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JDBC persistence for journal entries and their lines.
 *
 * Header and lines are always written together by the caller's transaction.
 * Methods named lock* take row locks that last until that transaction ends.
 */
@Repository
@RequiredArgsConstructor
public class JournalEntryRepository {

    private static final String SELECT_HEADER = """
        SELECT id, entry_number, voucher_type_id, entry_date, reference, description, currency,
               exchange_rate, fiscal_period_id, third_party_id, status, total_debit, total_credit,
               document_type_id, document_id, reversal_of_id, reversed_by_id, cancellation_reason,
               created_by, created_at, posted_by, posted_at
        FROM journal_entries
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public void insert(JournalEntry entry) {
        jdbcTemplate.update("""
            INSERT INTO journal_entries (
                id, entry_number, voucher_type_id, entry_date, reference, description, currency,
                exchange_rate, fiscal_period_id, third_party_id, status, total_debit, total_credit,
                document_type_id, document_id, reversal_of_id, reversed_by_id, cancellation_reason,
                created_by, created_at, updated_at, posted_by, posted_at)
            VALUES (
                :id, :entryNumber, :voucherTypeId, :date, :reference, :description, :currency,
                :exchangeRate, :fiscalPeriodId, :thirdPartyId, :status, :totalDebit, :totalCredit,
                :documentTypeId, :documentId, :reversalOfId, :reversedById, :cancellationReason,
                :createdBy, :createdAt, CURRENT_TIMESTAMP, :postedBy, :postedAt)
            """, headerParameters(entry));
        insertLines(entry);
    }

    /**
     * Rewrites the editable header fields and replaces the whole line set of a draft.
     */
    public void replaceContent(JournalEntry entry) {
        jdbcTemplate.update("""
            UPDATE journal_entries
            SET entry_date = :date, reference = :reference, description = :description,
                currency = :currency, exchange_rate = :exchangeRate, fiscal_period_id = :fiscalPeriodId,
                third_party_id = :thirdPartyId, total_debit = :totalDebit, total_credit = :totalCredit,
                updated_at = CURRENT_TIMESTAMP
            WHERE id = :id
            """, headerParameters(entry));
        jdbcTemplate.update("DELETE FROM journal_entry_lines WHERE entry_id = :id", Map.of("id", entry.getId()));
        insertLines(entry);
    }

    public void updateStatus(JournalEntry entry) {
        jdbcTemplate.update("""
            UPDATE journal_entries
            SET status = :status, posted_by = :postedBy, posted_at = :postedAt,
                reversed_by_id = :reversedById, cancellation_reason = :cancellationReason,
                updated_at = CURRENT_TIMESTAMP
            WHERE id = :id
            """, headerParameters(entry));
    }

    public void delete(UUID entryId) {
        Map<String, Object> params = Map.of("id", entryId);
        jdbcTemplate.update("DELETE FROM journal_entry_lines WHERE entry_id = :id", params);
        jdbcTemplate.update("DELETE FROM journal_entries WHERE id = :id", params);
    }

    public Optional<JournalEntry> findById(UUID entryId) {
        return jdbcTemplate.query(SELECT_HEADER + " WHERE id = :id", Map.of("id", entryId), headerRowMapper())
            .stream()
            .findFirst()
            .map(this::withLines);
    }

    public Optional<JournalEntry> lockById(UUID entryId) {
        return jdbcTemplate.query(SELECT_HEADER + " WHERE id = :id FOR UPDATE", Map.of("id", entryId), headerRowMapper())
            .stream()
            .findFirst()
            .map(this::withLines);
    }

    /**
     * Locks every entry generated from the document, in id order so concurrent callers
     * acquire the locks in the same sequence.
     */
    public List<JournalEntry> lockByDocumentId(UUID documentId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            SELECT_HEADER + " WHERE document_id = :documentId ORDER BY id FOR UPDATE",
            Map.of("documentId", documentId), headerRowMapper());
        return attachLines(headers);
    }

    public Optional<JournalEntry> findByDocumentAndVoucherType(UUID documentId, UUID voucherTypeId) {
        return jdbcTemplate.query(
                SELECT_HEADER + " WHERE document_id = :documentId AND voucher_type_id = :voucherTypeId",
                Map.of("documentId", documentId, "voucherTypeId", voucherTypeId), headerRowMapper())
            .stream()
            .findFirst()
            .map(this::withLines);
    }

    public boolean existsByNumber(UUID voucherTypeId, String entryNumber) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE voucher_type_id = :voucherTypeId AND entry_number = :entryNumber",
            Map.of("voucherTypeId", voucherTypeId, "entryNumber", entryNumber),
            Integer.class);
        return count != null && count > 0;
    }

    /**
     * Loads entries with their lines, returned in the order of the given ids.
     */
    public List<JournalEntry> findAllById(List<UUID> entryIds) {
        if (entryIds.isEmpty()) {
            return List.of();
        }
        Map<UUID, JournalEntry> byId = attachLines(jdbcTemplate.query(
                SELECT_HEADER + " WHERE id IN (:ids)", Map.of("ids", entryIds), headerRowMapper()))
            .stream()
            .collect(Collectors.toMap(JournalEntry::getId, Function.identity()));
        return entryIds.stream()
            .map(byId::get)
            .toList();
    }

    public void recordStatusChange(JournalEntry entry, EntryStatus previousStatus, String newStatus,
                                   String actorId, String comments) {
        jdbcTemplate.update("""
            INSERT INTO journal_entry_status_history
                (entry_id, entry_number, previous_status, new_status, actor_id, comments, changed_at)
            VALUES (:entryId, :entryNumber, :previousStatus, :newStatus, :actorId, :comments, CURRENT_TIMESTAMP)
            """,
            new MapSqlParameterSource()
                .addValue("entryId", entry.getId())
                .addValue("entryNumber", entry.getEntryNumber())
                .addValue("previousStatus", previousStatus != null ? previousStatus.name() : null)
                .addValue("newStatus", newStatus)
                .addValue("actorId", actorId)
                .addValue("comments", comments));
    }

    public List<StatusChange> findStatusHistory(UUID entryId) {
        return jdbcTemplate.query("""
            SELECT entry_id, entry_number, previous_status, new_status, actor_id, comments, changed_at
            FROM journal_entry_status_history
            WHERE entry_id = :entryId
            ORDER BY id
            """,
            Map.of("entryId", entryId),
            (rs, rowNum) -> new StatusChange(
                rs.getObject("entry_id", UUID.class),
                rs.getString("entry_number"),
                rs.getString("previous_status"),
                rs.getString("new_status"),
                rs.getString("actor_id"),
                rs.getString("comments"),
                rs.getTimestamp("changed_at").toInstant()
            ));
    }

    private void insertLines(JournalEntry entry) {
        SqlParameterSource[] batch = entry.getLines().stream()
            .map(line -> new MapSqlParameterSource()
                .addValue("id", line.getId())
                .addValue("entryId", entry.getId())
                .addValue("orderNumber", line.getOrderNumber())
                .addValue("accountId", line.getAccountId())
                .addValue("description", line.getDescription())
                .addValue("debitAmount", line.getDebitAmount())
                .addValue("creditAmount", line.getCreditAmount())
                .addValue("thirdPartyId", line.getThirdPartyId()))
            .toArray(SqlParameterSource[]::new);

        jdbcTemplate.batchUpdate("""
            INSERT INTO journal_entry_lines
                (id, entry_id, order_number, account_id, description, debit_amount, credit_amount, third_party_id)
            VALUES (:id, :entryId, :orderNumber, :accountId, :description, :debitAmount, :creditAmount, :thirdPartyId)
            """, batch);
    }

    private JournalEntry withLines(JournalEntry header) {
        return attachLines(List.of(header)).get(0);
    }

    private List<JournalEntry> attachLines(List<JournalEntry> headers) {
        if (headers.isEmpty()) {
            return headers;
        }
        List<UUID> ids = headers.stream().map(JournalEntry::getId).toList();
        Map<UUID, List<JournalLine>> linesByEntry = new LinkedHashMap<>();
        jdbcTemplate.query("""
            SELECT id, entry_id, order_number, account_id, description, debit_amount, credit_amount, third_party_id
            FROM journal_entry_lines
            WHERE entry_id IN (:ids)
            ORDER BY entry_id, order_number
            """,
            Map.of("ids", ids),
            rs -> {
                UUID entryId = rs.getObject("entry_id", UUID.class);
                linesByEntry.computeIfAbsent(entryId, key -> new ArrayList<>()).add(mapLine(rs));
            });

        List<JournalEntry> entries = new ArrayList<>(headers.size());
        for (JournalEntry header : headers) {
            List<JournalLine> lines = new ArrayList<>(linesByEntry.getOrDefault(header.getId(), List.of()));
            lines.sort(Comparator.comparingInt(JournalLine::getOrderNumber));
            entries.add(header.toBuilder().lines(List.copyOf(lines)).build());
        }
        return entries;
    }

    private JournalLine mapLine(ResultSet rs) throws SQLException {
        return new JournalLine(
            rs.getObject("id", UUID.class),
            rs.getInt("order_number"),
            rs.getObject("account_id", UUID.class),
            rs.getString("description"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            rs.getObject("third_party_id", UUID.class)
        );
    }

    private MapSqlParameterSource headerParameters(JournalEntry entry) {
        return new MapSqlParameterSource()
            .addValue("id", entry.getId())
            .addValue("entryNumber", entry.getEntryNumber())
            .addValue("voucherTypeId", entry.getVoucherTypeId())
            .addValue("date", entry.getDate())
            .addValue("reference", entry.getReference())
            .addValue("description", entry.getDescription())
            .addValue("currency", entry.getCurrency())
            .addValue("exchangeRate", entry.getExchangeRate())
            .addValue("fiscalPeriodId", entry.getFiscalPeriodId())
            .addValue("thirdPartyId", entry.getThirdPartyId())
            .addValue("status", entry.getStatus().name())
            .addValue("totalDebit", entry.getTotalDebit())
            .addValue("totalCredit", entry.getTotalCredit())
            .addValue("documentTypeId", entry.getDocumentTypeId())
            .addValue("documentId", entry.getDocumentId())
            .addValue("reversalOfId", entry.getReversalOfId())
            .addValue("reversedById", entry.getReversedById())
            .addValue("cancellationReason", entry.getCancellationReason())
            .addValue("createdBy", entry.getCreatedBy())
            .addValue("createdAt", toTimestamp(entry.getCreatedAt()))
            .addValue("postedBy", entry.getPostedBy())
            .addValue("postedAt", toTimestamp(entry.getPostedAt()));
    }

    private RowMapper<JournalEntry> headerRowMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .entryNumber(rs.getString("entry_number"))
            .voucherTypeId(rs.getObject("voucher_type_id", UUID.class))
            .date(rs.getObject("entry_date", LocalDate.class))
            .reference(rs.getString("reference"))
            .description(rs.getString("description"))
            .currency(rs.getString("currency"))
            .exchangeRate(rs.getBigDecimal("exchange_rate"))
            .fiscalPeriodId(rs.getObject("fiscal_period_id", UUID.class))
            .thirdPartyId(rs.getObject("third_party_id", UUID.class))
            .status(EntryStatus.valueOf(rs.getString("status")))
            .totalDebit(rs.getBigDecimal("total_debit"))
            .totalCredit(rs.getBigDecimal("total_credit"))
            .documentTypeId(rs.getObject("document_type_id", UUID.class))
            .documentId(rs.getObject("document_id", UUID.class))
            .reversalOfId(rs.getObject("reversal_of_id", UUID.class))
            .reversedById(rs.getObject("reversed_by_id", UUID.class))
            .cancellationReason(rs.getString("cancellation_reason"))
            .createdBy(rs.getString("created_by"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .postedBy(rs.getString("posted_by"))
            .postedAt(toInstant(rs.getTimestamp("posted_at")))
            .lines(List.of())
            .build();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
