package com.flagship.general_ledger.book;

import com.flagship.general_ledger.book.dto.JournalBookResponse;
import com.flagship.general_ledger.book.dto.LedgerStatementResponse;
import com.flagship.general_ledger.book.dto.TrialBalanceResponse;
import com.flagship.general_ledger.journal.EntryStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only books: journal (Libro Diario), account ledger (Libro Mayor), trial balance.
 */
@RestController
@RequestMapping("/api/books")
@RequiredArgsConstructor
public class BookController {

    private final JournalBookService journalBookService;
    private final BalanceEngine balanceEngine;
    private final TrialBalanceBuilder trialBalanceBuilder;

    @GetMapping("/journal")
    public ResponseEntity<JournalBookResponse> getJournalBook(
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "status", required = false) EntryStatus status,
            @RequestParam(name = "third_party_id", required = false) UUID thirdPartyId,
            @RequestParam(name = "fiscal_period_id", required = false) UUID fiscalPeriodId,
            @RequestParam(name = "entry_number", required = false) String entryNumber,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "0") int size) {

        JournalBookFilter filter = JournalBookFilter.builder()
            .range(DateRange.of(dateFrom, dateTo))
            .status(status)
            .thirdPartyId(thirdPartyId)
            .fiscalPeriodId(fiscalPeriodId)
            .entryNumber(entryNumber)
            .page(page)
            .size(size)
            .build();
        return ResponseEntity.ok(JournalBookResponse.from(journalBookService.getJournalBook(filter)));
    }

    @GetMapping("/ledger/{accountId}")
    public ResponseEntity<LedgerStatementResponse> getLedger(
            @PathVariable("accountId") UUID accountId,
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "fiscal_period_id", required = false) UUID fiscalPeriodId) {

        LedgerStatement statement = balanceEngine.ledgerFor(accountId, DateRange.of(dateFrom, dateTo), fiscalPeriodId);
        return ResponseEntity.ok(LedgerStatementResponse.from(statement));
    }

    @GetMapping("/trial-balance")
    public ResponseEntity<TrialBalanceResponse> getTrialBalance(
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "fiscal_period_id", required = false) UUID fiscalPeriodId,
            @RequestParam(name = "include_zero_balances", defaultValue = "false") boolean includeZeroBalances) {

        TrialBalance trialBalance = trialBalanceBuilder.build(DateRange.of(dateFrom, dateTo), fiscalPeriodId, includeZeroBalances);
        return ResponseEntity.ok(TrialBalanceResponse.from(trialBalance));
    }
}
