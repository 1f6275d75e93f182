package com.flagship.general_ledger.chart;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcChartOfAccountsGateway implements ChartOfAccountsGateway {

    private static final String SELECT_ACCOUNT =
        "SELECT id, code, name, normal_balance, allows_entries, active FROM chart_of_accounts ";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<Account> findById(UUID accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = :id",
                Map.of("id", accountId), accountRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public Map<UUID, Account> findAllById(Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Map.of();
        }
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id IN (:ids)",
                Map.of("ids", accountIds), accountRowMapper())
            .stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    @Override
    public List<Account> findPostableAccounts() {
        return jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE active = TRUE AND allows_entries = TRUE ORDER BY code",
            accountRowMapper());
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            NormalBalance.valueOf(rs.getString("normal_balance")),
            rs.getBoolean("allows_entries"),
            rs.getBoolean("active")
        );
    }
}
