package com.flagship.general_ledger.journal;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Header and lines for creating or replacing a draft journal entry.
 *
 * Invariant: debits equal credits within {@link #BALANCE_TOLERANCE}.
 * {@link #validate()} checks everything that can be decided without reference data.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JournalEntryRequest {

    /**
     * Monetary rounding tolerance for debit/credit equality.
     */
    public static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.01");

    public static final int MONEY_SCALE = 2;

    /**
     * Optional; allocated from the voucher type sequence when absent.
     */
    @Size(max = 40, message = "Entry number is at most 40 characters")
    @JsonProperty("entry_number")
    String entryNumber;

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type_id")
    UUID voucherTypeId;

    @NotNull(message = "Entry date is required")
    @JsonProperty("date")
    LocalDate date;

    @Size(max = 100, message = "Reference is at most 100 characters")
    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @DecimalMin(value = "0.000001", message = "Exchange rate must be positive")
    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @NotNull(message = "Fiscal period is required")
    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @JsonProperty("third_party_id")
    UUID thirdPartyId;

    @NotEmpty(message = "Entry must have at least one line")
    @Valid
    @JsonProperty("lines")
    List<Line> lines;

    public BigDecimal getDebitTotal() {
        return safeLines().stream()
            .map(Line::debitOrZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return safeLines().stream()
            .map(Line::creditOrZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * debits - credits
     */
    public BigDecimal getDifference() {
        return getDebitTotal().subtract(getCreditTotal());
    }

    public boolean isBalanced() {
        return getDifference().abs().compareTo(BALANCE_TOLERANCE) < 0;
    }

    public BigDecimal effectiveExchangeRate() {
        return exchangeRate != null ? exchangeRate : BigDecimal.ONE;
    }

    /**
     * Collects every structural violation: missing header fields, malformed lines, imbalance.
     * Empty when the request is well formed.
     */
    public List<String> validate() {
        List<String> violations = new ArrayList<>();

        if (voucherTypeId == null) {
            violations.add("Voucher type is required");
        }
        if (date == null) {
            violations.add("Entry date is required");
        }
        if (fiscalPeriodId == null) {
            violations.add("Fiscal period is required");
        }
        if (currency == null || !currency.matches("^[A-Z]{3}$")) {
            violations.add("Currency must be a 3-letter ISO code");
        }
        if (exchangeRate != null && exchangeRate.signum() <= 0) {
            violations.add("Exchange rate must be positive");
        }

        if (lines == null || lines.isEmpty()) {
            violations.add("Entry must have at least one line");
            return violations;
        }

        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line == null) {
                violations.add(String.format("Line %d: line is required", i + 1));
            } else {
                line.validate(i + 1, violations);
            }
        }

        if (!isBalanced()) {
            violations.add(String.format(
                "Entry is not balanced: debits=%s, credits=%s, difference=%s",
                getDebitTotal(), getCreditTotal(), getDifference().abs()));
        }
        return violations;
    }

    private List<Line> safeLines() {
        if (lines == null) {
            return List.of();
        }
        return lines.stream().filter(Objects::nonNull).toList();
    }

    /**
     * A single debit or credit movement.
     */
    @Value
    @Builder
    @Jacksonized
    public static class Line {

        @NotNull(message = "Account is required")
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("description")
        String description;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("third_party_id")
        UUID thirdPartyId;

        public static Line debit(UUID accountId, BigDecimal amount, String description) {
            return Line.builder()
                .accountId(accountId)
                .debitAmount(amount)
                .creditAmount(BigDecimal.ZERO)
                .description(description)
                .build();
        }

        public static Line credit(UUID accountId, BigDecimal amount, String description) {
            return Line.builder()
                .accountId(accountId)
                .debitAmount(BigDecimal.ZERO)
                .creditAmount(amount)
                .description(description)
                .build();
        }

        BigDecimal debitOrZero() {
            return debitAmount != null ? debitAmount : BigDecimal.ZERO;
        }

        BigDecimal creditOrZero() {
            return creditAmount != null ? creditAmount : BigDecimal.ZERO;
        }

        void validate(int position, List<String> violations) {
            BigDecimal debit = debitOrZero();
            BigDecimal credit = creditOrZero();

            if (accountId == null) {
                violations.add(String.format("Line %d: account is required", position));
            }
            if (debit.signum() < 0 || credit.signum() < 0) {
                violations.add(String.format("Line %d: amounts cannot be negative", position));
                return;
            }
            if (debit.stripTrailingZeros().scale() > MONEY_SCALE || credit.stripTrailingZeros().scale() > MONEY_SCALE) {
                violations.add(String.format("Line %d: amounts allow at most %d decimal places", position, MONEY_SCALE));
            }
            if (debit.signum() > 0 && credit.signum() > 0) {
                violations.add(String.format("Line %d: a line carries either a debit or a credit, not both", position));
            } else if (debit.signum() == 0 && credit.signum() == 0) {
                violations.add(String.format("Line %d: a debit or credit amount is required", position));
            }
        }
    }
}
