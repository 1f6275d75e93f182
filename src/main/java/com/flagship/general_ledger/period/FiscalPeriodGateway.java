package com.flagship.general_ledger.period;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to fiscal periods.
 */
public interface FiscalPeriodGateway {

    Optional<FiscalPeriod> findById(UUID periodId);

    /**
     * The open period whose range contains the date, if any.
     */
    Optional<FiscalPeriod> findOpenContaining(LocalDate date);
}
