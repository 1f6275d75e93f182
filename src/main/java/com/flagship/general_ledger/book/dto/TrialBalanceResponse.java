package com.flagship.general_ledger.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.book.TrialBalance;
import com.flagship.general_ledger.chart.NormalBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class TrialBalanceResponse {

    @JsonProperty("date_from")
    LocalDate dateFrom;

    @JsonProperty("date_to")
    LocalDate dateTo;

    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @JsonProperty("rows")
    List<Row> rows;

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("balance_check")
    BalanceCheck balanceCheck;

    public static TrialBalanceResponse from(TrialBalance trialBalance) {
        TrialBalance.Totals totals = trialBalance.getTotals();
        TrialBalance.BalanceCheck check = trialBalance.getBalanceCheck();
        return new TrialBalanceResponse(
            trialBalance.getRange().getFrom(),
            trialBalance.getRange().getTo(),
            trialBalance.getFiscalPeriodId(),
            trialBalance.getRows().stream().map(Row::from).toList(),
            new Totals(totals.getTotalDebit(), totals.getTotalCredit(),
                totals.getDebtorBalance(), totals.getCreditorBalance()),
            new BalanceCheck(check.isBalanced(), check.getDebitCreditDifference(), check.getBalanceDifference())
        );
    }

    @Value
    public static class Row {

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("normal_balance")
        NormalBalance normalBalance;

        @JsonProperty("total_debit")
        BigDecimal totalDebit;

        @JsonProperty("total_credit")
        BigDecimal totalCredit;

        @JsonProperty("debtor_balance")
        BigDecimal debtorBalance;

        @JsonProperty("creditor_balance")
        BigDecimal creditorBalance;

        @JsonProperty("contra_balance")
        boolean contraBalance;

        static Row from(TrialBalance.Row row) {
            return new Row(row.getAccountId(), row.getAccountCode(), row.getAccountName(), row.getNormalBalance(),
                row.getTotalDebit(), row.getTotalCredit(), row.getDebtorBalance(), row.getCreditorBalance(),
                row.isContraBalance());
        }
    }

    @Value
    public static class Totals {

        @JsonProperty("total_debit")
        BigDecimal totalDebit;

        @JsonProperty("total_credit")
        BigDecimal totalCredit;

        @JsonProperty("debtor_balance")
        BigDecimal debtorBalance;

        @JsonProperty("creditor_balance")
        BigDecimal creditorBalance;
    }

    @Value
    public static class BalanceCheck {

        @JsonProperty("balanced")
        boolean balanced;

        @JsonProperty("debit_credit_difference")
        BigDecimal debitCreditDifference;

        @JsonProperty("balance_difference")
        BigDecimal balanceDifference;
    }
}
