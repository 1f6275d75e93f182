package com.flagship.general_ledger.period;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Opens and closes fiscal periods.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodService {

    private final JdbcTemplate jdbcTemplate;
    private final FiscalPeriodGateway periodGateway;

    @Transactional
    public UUID openPeriod(String name, LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new ValidationException(
                String.format("Fiscal period end %s is before its start %s", endDate, startDate));
        }
        UUID periodId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO fiscal_periods (id, name, start_date, end_date, closed, created_at) " +
            "VALUES (?, ?, ?, ?, FALSE, CURRENT_TIMESTAMP)",
            periodId, name, startDate, endDate);
        log.info("Opened fiscal period {}: {} to {}", name, startDate, endDate);
        return periodId;
    }

    /**
     * Closing is one-way: no entry can be posted into the period afterwards.
     */
    @Transactional
    public FiscalPeriod closePeriod(UUID periodId) {
        FiscalPeriod period = periodGateway.findById(periodId)
            .orElseThrow(() -> new NotFoundException("Fiscal period", periodId));
        if (period.isClosed()) {
            throw new InvalidStateException("Fiscal period " + period.getName() + " is already closed");
        }
        jdbcTemplate.update(
            "UPDATE fiscal_periods SET closed = TRUE, closed_at = CURRENT_TIMESTAMP WHERE id = ?", periodId);
        log.info("Closed fiscal period {}", period.getName());
        return new FiscalPeriod(period.getId(), period.getName(), period.getStartDate(), period.getEndDate(), true);
    }
}
