package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.exception.ConflictException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * - ledger.entries.operations{operation, outcome}: create/update/post/reverse/delete/cancel results
 * - ledger.operations.latency{operation}: duration of each mutating or reporting operation
 * - ledger.trial_balance{balanced}: trial balances built, split by check outcome
 * - ledger.documents.operations{operation, outcome}: voucher generation and document cancellation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEntryOperation(String operation, String outcome) {
        registry.counter("ledger.entries.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDocumentOperation(String operation, String outcome) {
        registry.counter("ledger.documents.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operations.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordTrialBalance(boolean balanced) {
        registry.counter("ledger.trial_balance",
                "balanced", String.valueOf(balanced)
        ).increment();
    }

    /**
     * Maps an exception to a bounded outcome tag.
     */
    public static String outcomeOf(Exception e) {
        if (e instanceof ValidationException) {
            return "validation_error";
        }
        if (e instanceof NotFoundException) {
            return "not_found";
        }
        if (e instanceof InvalidStateException) {
            return "invalid_state";
        }
        if (e instanceof ConflictException) {
            return "conflict";
        }
        return "error";
    }

    // Keeps tag cardinality bounded
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
