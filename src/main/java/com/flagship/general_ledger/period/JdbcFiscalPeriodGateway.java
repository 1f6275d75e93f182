package com.flagship.general_ledger.period;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcFiscalPeriodGateway implements FiscalPeriodGateway {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<FiscalPeriod> findById(UUID periodId) {
        return jdbcTemplate.query(
                "SELECT id, name, start_date, end_date, closed FROM fiscal_periods WHERE id = :id",
                Map.of("id", periodId), periodRowMapper())
            .stream()
            .findFirst();
    }

    @Override
    public Optional<FiscalPeriod> findOpenContaining(LocalDate date) {
        // Narrowest period wins when a month sits inside an open year
        return jdbcTemplate.query("""
                SELECT id, name, start_date, end_date, closed
                FROM fiscal_periods
                WHERE closed = FALSE AND start_date <= :date AND end_date >= :date
                ORDER BY end_date - start_date, start_date DESC
                LIMIT 1
                """,
                Map.of("date", date), periodRowMapper())
            .stream()
            .findFirst();
    }

    private RowMapper<FiscalPeriod> periodRowMapper() {
        return (rs, rowNum) -> new FiscalPeriod(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getObject("start_date", LocalDate.class),
            rs.getObject("end_date", LocalDate.class),
            rs.getBoolean("closed")
        );
    }
}
