package com.flagship.general_ledger.book;

import com.flagship.general_ledger.chart.Account;
import com.flagship.general_ledger.chart.NormalBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Libro Mayor of one account: opening balance, movements with running balance, closing balance.
 *
 * Balances are signed by the account's normal balance, so a positive figure is
 * a balance on the account's natural side.
 */
@Value
public class LedgerStatement {
    Account account;
    DateRange range;
    BigDecimal openingBalance;
    List<LedgerMovement> movements;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    BigDecimal closingBalance;

    /**
     * @param lines movements in range, already ordered by date, entry number and line order
     */
    public static LedgerStatement assemble(Account account, DateRange range, BigDecimal openingBalance,
                                           List<PostedLine> lines) {
        NormalBalance side = account.getNormalBalance();
        BigDecimal running = openingBalance;
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        List<LedgerMovement> movements = new ArrayList<>(lines.size());

        for (PostedLine line : lines) {
            running = running.add(side.signed(line.getDebitAmount(), line.getCreditAmount()));
            totalDebit = totalDebit.add(line.getDebitAmount());
            totalCredit = totalCredit.add(line.getCreditAmount());
            movements.add(new LedgerMovement(
                line.getEntryId(),
                line.getEntryNumber(),
                line.getDate(),
                line.getOrderNumber(),
                line.getDescription(),
                line.getDebitAmount(),
                line.getCreditAmount(),
                line.getThirdPartyId(),
                running
            ));
        }
        return new LedgerStatement(account, range, openingBalance, List.copyOf(movements),
            totalDebit, totalCredit, running);
    }
}
