package com.flagship.general_ledger.book;

import com.flagship.general_ledger.chart.Account;
import com.flagship.general_ledger.chart.ChartOfAccountsGateway;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Libro Mayor: the ledger of one account over a date range.
 *
 * Opening balance covers every ledger-effective line dated before the range start
 * (zero without a lower bound). The optional fiscal period restricts only the movements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceEngine {

    private final ChartOfAccountsGateway chartOfAccounts;
    private final BookRepository bookRepository;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(readOnly = true)
    public LedgerStatement ledgerFor(UUID accountId, DateRange range, UUID fiscalPeriodId) {
        long startTime = System.currentTimeMillis();
        Account account = chartOfAccounts.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));

        BigDecimal opening = BigDecimal.ZERO;
        if (range.getFrom() != null) {
            AccountTotals before = bookRepository.totalsBefore(accountId, range.getFrom());
            opening = account.getNormalBalance().signed(before.getTotalDebit(), before.getTotalCredit());
        }
        List<PostedLine> lines = bookRepository.findLines(accountId, range, fiscalPeriodId);
        LedgerStatement statement = LedgerStatement.assemble(account, range, opening, lines);

        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordLatency("ledger", duration);
        log.debug("Ledger built: account={}, movements={}, opening={}, closing={}, duration={}ms",
            account.getCode(), lines.size(), opening, statement.getClosingBalance(), duration);
        return statement;
    }
}
