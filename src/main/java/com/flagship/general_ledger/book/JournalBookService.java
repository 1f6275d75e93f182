package com.flagship.general_ledger.book;

import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.EntryStatus;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryRepository;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Libro Diario: entries with their lines in date and number order, one page at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalBookService {

    private final BookRepository bookRepository;
    private final JournalEntryRepository entryRepository;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.journal-book.default-page-size:25}")
    private int defaultPageSize;

    @Value("${ledger.journal-book.max-page-size:500}")
    private int maxPageSize;

    @Transactional(readOnly = true)
    public JournalBookPage getJournalBook(JournalBookFilter filter) {
        long startTime = System.currentTimeMillis();

        if (filter.getPage() < 0) {
            throw new ValidationException("Page must not be negative");
        }
        int size = filter.getSize() > 0 ? filter.getSize() : defaultPageSize;
        if (size > maxPageSize) {
            throw new ValidationException("Page size must not exceed " + maxPageSize);
        }
        EntryStatus status = filter.getStatus();
        if (status != null && !status.isLedgerEffective()) {
            throw new ValidationException("The journal book lists only POSTED and REVERSED entries, not " + status);
        }
        List<String> statuses = status != null
            ? List.of(status.name())
            : BookRepository.LEDGER_EFFECTIVE;

        long total = bookRepository.countEntries(filter, statuses);
        List<JournalEntry> entries = List.of();
        if (total > (long) filter.getPage() * size) {
            List<UUID> ids = bookRepository.findEntryIds(filter, statuses, filter.getPage(), size);
            entries = entryRepository.findAllById(ids);
        }
        int totalPages = (int) ((total + size - 1) / size);

        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordLatency("journal_book", duration);
        log.debug("Journal book page {} built: entries={}, total={}, duration={}ms",
            filter.getPage(), entries.size(), total, duration);

        return new JournalBookPage(entries, filter.getPage(), size, total, totalPages);
    }
}
