package com.flagship.general_ledger.book;

import com.flagship.general_ledger.chart.Account;
import com.flagship.general_ledger.chart.ChartOfAccountsGateway;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the trial balance over every active postable account.
 * Read-only; the same inputs always yield the same result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrialBalanceBuilder {

    private final ChartOfAccountsGateway chartOfAccounts;
    private final BookRepository bookRepository;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(readOnly = true)
    public TrialBalance build(DateRange range, UUID fiscalPeriodId, boolean includeZeroBalances) {
        long startTime = System.currentTimeMillis();

        List<Account> accounts = chartOfAccounts.findPostableAccounts();
        Map<UUID, AccountTotals> totals = bookRepository.totalsByAccount(range, fiscalPeriodId);
        TrialBalance trialBalance = TrialBalance.assemble(range, fiscalPeriodId, accounts, totals, includeZeroBalances);

        boolean balanced = trialBalance.getBalanceCheck().isBalanced();
        ledgerMetrics.recordTrialBalance(balanced);
        ledgerMetrics.recordLatency("trial_balance", System.currentTimeMillis() - startTime);
        if (!balanced) {
            log.warn("Trial balance does not balance: debitCreditDifference={}, balanceDifference={}",
                trialBalance.getBalanceCheck().getDebitCreditDifference(),
                trialBalance.getBalanceCheck().getBalanceDifference());
        }
        return trialBalance;
    }
}
