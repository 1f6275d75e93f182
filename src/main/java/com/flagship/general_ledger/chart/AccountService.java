package com.flagship.general_ledger.chart;

import com.flagship.general_ledger.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Maintenance of the local chart of accounts table.
 * Account hierarchy and reporting groups are managed elsewhere; this covers what posting needs.
 */
@Service
@Slf4j
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public UUID createAccount(String code, String name, NormalBalance normalBalance, boolean allowsEntries) {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO chart_of_accounts (id, code, name, normal_balance, allows_entries, active, created_at) " +
            "VALUES (?, ?, ?, ?, ?, TRUE, CURRENT_TIMESTAMP)",
            accountId,
            code,
            name,
            normalBalance.name(),
            allowsEntries
        );
        log.info("Created account: code={}, normalBalance={}, allowsEntries={}", code, normalBalance, allowsEntries);
        return accountId;
    }

    /**
     * Deactivated accounts keep their history but accept no new lines.
     */
    @Transactional
    public void deactivate(UUID accountId) {
        int updated = jdbcTemplate.update("UPDATE chart_of_accounts SET active = FALSE WHERE id = ?", accountId);
        if (updated == 0) {
            throw new NotFoundException("Account", accountId);
        }
        log.info("Deactivated account {}", accountId);
    }
}
