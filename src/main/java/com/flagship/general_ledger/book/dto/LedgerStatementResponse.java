package com.flagship.general_ledger.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.book.LedgerMovement;
import com.flagship.general_ledger.book.LedgerStatement;
import com.flagship.general_ledger.chart.NormalBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LedgerStatementResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("normal_balance")
    NormalBalance normalBalance;

    @JsonProperty("date_from")
    LocalDate dateFrom;

    @JsonProperty("date_to")
    LocalDate dateTo;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("movements")
    List<Movement> movements;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    public static LedgerStatementResponse from(LedgerStatement statement) {
        return LedgerStatementResponse.builder()
            .accountId(statement.getAccount().getId())
            .accountCode(statement.getAccount().getCode())
            .accountName(statement.getAccount().getName())
            .normalBalance(statement.getAccount().getNormalBalance())
            .dateFrom(statement.getRange().getFrom())
            .dateTo(statement.getRange().getTo())
            .openingBalance(statement.getOpeningBalance())
            .movements(statement.getMovements().stream().map(Movement::from).toList())
            .totalDebit(statement.getTotalDebit())
            .totalCredit(statement.getTotalCredit())
            .closingBalance(statement.getClosingBalance())
            .build();
    }

    @Value
    public static class Movement {

        @JsonProperty("entry_id")
        UUID entryId;

        @JsonProperty("entry_number")
        String entryNumber;

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("order_number")
        int orderNumber;

        @JsonProperty("description")
        String description;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("third_party_id")
        UUID thirdPartyId;

        @JsonProperty("running_balance")
        BigDecimal runningBalance;

        static Movement from(LedgerMovement movement) {
            return new Movement(movement.getEntryId(), movement.getEntryNumber(), movement.getDate(),
                movement.getOrderNumber(), movement.getDescription(), movement.getDebitAmount(),
                movement.getCreditAmount(), movement.getThirdPartyId(), movement.getRunningBalance());
        }
    }
}
