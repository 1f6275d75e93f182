package com.flagship.general_ledger.sequence;

import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Issues gap-free numbers per voucher type and per document type.
 *
 * The counter row is locked with SELECT ... FOR UPDATE and incremented inside the
 * caller's transaction, the same one that inserts the numbered header:
 * - concurrent callers for the same type queue on the row lock
 * - a caller that rolls back also rolls back its increment, so no number is skipped
 * - callers for different types never contend
 *
 * MANDATORY propagation: allocating outside the owning transaction would break both guarantees.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceAllocator {

    private final NumberingTypeRepository numberingTypes;

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextVoucherNumber(UUID voucherTypeId) {
        return next(NumberingScope.VOUCHER, voucherTypeId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextDocumentNumber(UUID documentTypeId) {
        return next(NumberingScope.DOCUMENT, documentTypeId);
    }

    /**
     * Accepts a caller-supplied voucher number under the same row lock the allocator takes.
     * Numbers shaped like the type's own series are refused: only the counter hands those out.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void reserveSuppliedVoucherNumber(UUID voucherTypeId, String suppliedNumber) {
        NumberingType type = lockActive(NumberingScope.VOUCHER, voucherTypeId);
        if (type.isInSeries(suppliedNumber)) {
            throw new ValidationException(String.format(
                "Entry number %s belongs to the %s series; leave it empty to have one allocated",
                suppliedNumber, type.getCode()));
        }
    }

    private NumberingType lockActive(NumberingScope scope, UUID typeId) {
        NumberingType type = numberingTypes.lockById(scope, typeId)
            .orElseThrow(() -> new NotFoundException(scope.label(), typeId));

        if (!type.isActive()) {
            throw new ValidationException(scope.label() + " " + type.getCode() + " is inactive");
        }
        return type;
    }

    private String next(NumberingScope scope, UUID typeId) {
        NumberingType type = lockActive(scope, typeId);

        long next = type.getLastNumber() + 1;
        numberingTypes.updateLastNumber(scope, typeId, next);

        String number = type.format(next);
        log.debug("Allocated {} number {}", scope.label().toLowerCase(), number);
        return number;
    }
}
