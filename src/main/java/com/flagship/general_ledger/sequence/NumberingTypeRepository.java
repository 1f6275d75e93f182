package com.flagship.general_ledger.sequence;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to voucher_types and document_types.
 */
@Repository
@RequiredArgsConstructor
public class NumberingTypeRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<NumberingType> findById(NumberingScope scope, UUID typeId) {
        return jdbcTemplate.query(
                "SELECT id, code, name, last_number, padding, active FROM " + scope.table() + " WHERE id = ?",
                numberingTypeRowMapper(), typeId)
            .stream()
            .findFirst();
    }

    public Optional<NumberingType> findByCode(NumberingScope scope, String code) {
        return jdbcTemplate.query(
                "SELECT id, code, name, last_number, padding, active FROM " + scope.table() + " WHERE code = ?",
                numberingTypeRowMapper(), code)
            .stream()
            .findFirst();
    }

    /**
     * Reads the type row and holds its lock until the surrounding transaction ends.
     */
    Optional<NumberingType> lockById(NumberingScope scope, UUID typeId) {
        return jdbcTemplate.query(
                "SELECT id, code, name, last_number, padding, active FROM " + scope.table() +
                " WHERE id = ? FOR UPDATE",
                numberingTypeRowMapper(), typeId)
            .stream()
            .findFirst();
    }

    void updateLastNumber(NumberingScope scope, UUID typeId, long lastNumber) {
        jdbcTemplate.update("UPDATE " + scope.table() + " SET last_number = ? WHERE id = ?", lastNumber, typeId);
    }

    public UUID create(NumberingScope scope, String code, String name, int padding) {
        UUID typeId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO " + scope.table() + " (id, code, name, last_number, padding, active, created_at) " +
            "VALUES (?, ?, ?, 0, ?, TRUE, CURRENT_TIMESTAMP)",
            typeId, code, name, padding);
        return typeId;
    }

    private RowMapper<NumberingType> numberingTypeRowMapper() {
        return (rs, rowNum) -> new NumberingType(
            rs.getObject("id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            rs.getLong("last_number"),
            rs.getInt("padding"),
            rs.getBoolean("active")
        );
    }
}
