package com.flagship.general_ledger.book;

import com.flagship.general_ledger.journal.EntryStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side queries behind the books. Everything is aggregated at read time from the
 * lines of ledger-effective entries; no balance is stored.
 */
@Repository
@RequiredArgsConstructor
public class BookRepository {

    static final List<String> LEDGER_EFFECTIVE = Arrays.stream(EntryStatus.values())
        .filter(EntryStatus::isLedgerEffective)
        .map(Enum::name)
        .toList();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Sums of the account's lines dated strictly before the given date.
     */
    public AccountTotals totalsBefore(UUID accountId, LocalDate before) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("before", before)
            .addValue("statuses", LEDGER_EFFECTIVE);
        return jdbcTemplate.queryForObject("""
            SELECT COALESCE(SUM(l.debit_amount), 0) AS total_debit,
                   COALESCE(SUM(l.credit_amount), 0) AS total_credit
            FROM journal_entry_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            WHERE l.account_id = :accountId
              AND e.status IN (:statuses)
              AND e.entry_date < :before
            """,
            params,
            (rs, rowNum) -> new AccountTotals(accountId, rs.getBigDecimal("total_debit"), rs.getBigDecimal("total_credit")));
    }

    /**
     * Lines of the account in range, ordered by date, entry number and line order.
     */
    public List<PostedLine> findLines(UUID accountId, DateRange range, UUID fiscalPeriodId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("statuses", LEDGER_EFFECTIVE);
        StringBuilder sql = new StringBuilder("""
            SELECT e.id AS entry_id, e.entry_number, e.entry_date, l.order_number,
                   COALESCE(l.description, e.description) AS description,
                   l.debit_amount, l.credit_amount, l.third_party_id
            FROM journal_entry_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            WHERE l.account_id = :accountId
              AND e.status IN (:statuses)
            """);
        appendEntryFilters(sql, params, range, fiscalPeriodId);
        sql.append(" ORDER BY e.entry_date, e.entry_number, l.order_number");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new PostedLine(
            rs.getObject("entry_id", UUID.class),
            rs.getString("entry_number"),
            rs.getObject("entry_date", LocalDate.class),
            rs.getInt("order_number"),
            rs.getString("description"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            rs.getObject("third_party_id", UUID.class)
        ));
    }

    /**
     * Debit and credit sums per account over the range. Accounts without lines are absent.
     */
    public Map<UUID, AccountTotals> totalsByAccount(DateRange range, UUID fiscalPeriodId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("statuses", LEDGER_EFFECTIVE);
        StringBuilder sql = new StringBuilder("""
            SELECT l.account_id,
                   SUM(l.debit_amount) AS total_debit,
                   SUM(l.credit_amount) AS total_credit
            FROM journal_entry_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            WHERE e.status IN (:statuses)
            """);
        appendEntryFilters(sql, params, range, fiscalPeriodId);
        sql.append(" GROUP BY l.account_id");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new AccountTotals(
                rs.getObject("account_id", UUID.class),
                rs.getBigDecimal("total_debit"),
                rs.getBigDecimal("total_credit")))
            .stream()
            .collect(Collectors.toMap(AccountTotals::getAccountId, Function.identity()));
    }

    public long countEntries(JournalBookFilter filter, Collection<String> statuses) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM journal_entries e WHERE 1 = 1");
        appendBookFilters(sql, params, filter, statuses);
        Long count = jdbcTemplate.queryForObject(sql.toString(), params, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Ids of one page of matching entries, ordered by date and entry number.
     */
    public List<UUID> findEntryIds(JournalBookFilter filter, Collection<String> statuses, int page, int size) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", size)
            .addValue("offset", (long) page * size);
        StringBuilder sql = new StringBuilder("SELECT e.id FROM journal_entries e WHERE 1 = 1");
        appendBookFilters(sql, params, filter, statuses);
        sql.append(" ORDER BY e.entry_date, e.entry_number, e.id LIMIT :limit OFFSET :offset");

        return jdbcTemplate.queryForList(sql.toString(), params, UUID.class);
    }

    private static void appendEntryFilters(StringBuilder sql, MapSqlParameterSource params,
                                           DateRange range, UUID fiscalPeriodId) {
        if (range.getFrom() != null) {
            sql.append(" AND e.entry_date >= :dateFrom");
            params.addValue("dateFrom", range.getFrom());
        }
        if (range.getTo() != null) {
            sql.append(" AND e.entry_date <= :dateTo");
            params.addValue("dateTo", range.getTo());
        }
        if (fiscalPeriodId != null) {
            sql.append(" AND e.fiscal_period_id = :fiscalPeriodId");
            params.addValue("fiscalPeriodId", fiscalPeriodId);
        }
    }

    private static void appendBookFilters(StringBuilder sql, MapSqlParameterSource params,
                                          JournalBookFilter filter, Collection<String> statuses) {
        sql.append(" AND e.status IN (:statuses)");
        params.addValue("statuses", statuses);
        appendEntryFilters(sql, params, filter.getRange(), filter.getFiscalPeriodId());
        if (filter.getThirdPartyId() != null) {
            sql.append(" AND e.third_party_id = :thirdPartyId");
            params.addValue("thirdPartyId", filter.getThirdPartyId());
        }
        if (filter.getEntryNumber() != null && !filter.getEntryNumber().isBlank()) {
            sql.append(" AND e.entry_number ILIKE :entryNumber");
            params.addValue("entryNumber", "%" + escapeLike(filter.getEntryNumber().trim()) + "%");
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
