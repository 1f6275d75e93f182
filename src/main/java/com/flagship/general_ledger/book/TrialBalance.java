package com.flagship.general_ledger.book;

import com.flagship.general_ledger.chart.Account;
import com.flagship.general_ledger.chart.NormalBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Balance de Comprobación.
 *
 * Each row splits debit - credit into a debtor balance (positive) or a creditor balance
 * (negative, shown as its absolute value). The books are consistent when total debits equal
 * total credits and total debtor balances equal total creditor balances.
 */
@Value
public class TrialBalance {

    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    DateRange range;
    UUID fiscalPeriodId;
    List<Row> rows;
    Totals totals;
    BalanceCheck balanceCheck;

    /**
     * @param accounts active postable accounts
     * @param totalsByAccount sums for accounts with movements; others count as zero
     * @param includeZeroBalances keep accounts without any movement
     */
    public static TrialBalance assemble(DateRange range, UUID fiscalPeriodId, List<Account> accounts,
                                        Map<UUID, AccountTotals> totalsByAccount, boolean includeZeroBalances) {
        List<Row> rows = new ArrayList<>();
        for (Account account : accounts) {
            AccountTotals sums = totalsByAccount.get(account.getId());
            BigDecimal debit = sums != null ? sums.getTotalDebit() : BigDecimal.ZERO;
            BigDecimal credit = sums != null ? sums.getTotalCredit() : BigDecimal.ZERO;
            if (!includeZeroBalances && debit.add(credit).signum() == 0) {
                continue;
            }
            rows.add(Row.of(account, debit, credit));
        }
        rows.sort(Comparator.comparing(Row::getAccountCode));

        Totals totals = Totals.of(rows);
        BigDecimal debitCreditDifference = totals.getTotalDebit().subtract(totals.getTotalCredit()).abs();
        BigDecimal balanceDifference = totals.getDebtorBalance().subtract(totals.getCreditorBalance()).abs();
        BalanceCheck check = new BalanceCheck(
            debitCreditDifference.compareTo(TOLERANCE) < 0 && balanceDifference.compareTo(TOLERANCE) < 0,
            debitCreditDifference,
            balanceDifference
        );
        return new TrialBalance(range, fiscalPeriodId, List.copyOf(rows), totals, check);
    }

    @Value
    public static class Row {
        UUID accountId;
        String accountCode;
        String accountName;
        NormalBalance normalBalance;
        BigDecimal totalDebit;
        BigDecimal totalCredit;
        BigDecimal debtorBalance;
        BigDecimal creditorBalance;
        /**
         * The balance sits on the side opposite the account's normal balance.
         */
        boolean contraBalance;

        static Row of(Account account, BigDecimal debit, BigDecimal credit) {
            BigDecimal difference = debit.subtract(credit);
            BigDecimal debtor = difference.signum() > 0 ? difference : BigDecimal.ZERO;
            BigDecimal creditor = difference.signum() < 0 ? difference.negate() : BigDecimal.ZERO;
            boolean contra = account.getNormalBalance() == NormalBalance.DEBIT
                ? creditor.signum() > 0
                : debtor.signum() > 0;
            return new Row(account.getId(), account.getCode(), account.getName(), account.getNormalBalance(),
                debit, credit, debtor, creditor, contra);
        }
    }

    @Value
    public static class Totals {
        BigDecimal totalDebit;
        BigDecimal totalCredit;
        BigDecimal debtorBalance;
        BigDecimal creditorBalance;

        static Totals of(List<Row> rows) {
            BigDecimal debit = BigDecimal.ZERO;
            BigDecimal credit = BigDecimal.ZERO;
            BigDecimal debtor = BigDecimal.ZERO;
            BigDecimal creditor = BigDecimal.ZERO;
            for (Row row : rows) {
                debit = debit.add(row.getTotalDebit());
                credit = credit.add(row.getTotalCredit());
                debtor = debtor.add(row.getDebtorBalance());
                creditor = creditor.add(row.getCreditorBalance());
            }
            return new Totals(debit, credit, debtor, creditor);
        }
    }

    @Value
    public static class BalanceCheck {
        boolean balanced;
        /**
         * |total debits - total credits|
         */
        BigDecimal debitCreditDifference;
        /**
         * |debtor balances - creditor balances|
         */
        BigDecimal balanceDifference;
    }
}
