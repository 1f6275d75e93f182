package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import com.flagship.general_ledger.journal.dto.ReversalResponse;
import com.flagship.general_ledger.journal.dto.ReverseEntryRequest;
import com.flagship.general_ledger.journal.dto.StatusChangeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for journal entries.
 *
 * Mutations require the X-Actor-Id header; it is recorded as creator, poster and in the status history.
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    private final JournalEntryStore store;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> createEntry(
            @Valid @RequestBody JournalEntryRequest request,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        log.info("Received journal entry creation request: voucherType={}, date={}, lines={}",
            request.getVoucherTypeId(), request.getDate(), request.getLines().size());

        JournalEntry created = store.create(request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(created));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JournalEntryResponse> getEntry(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(JournalEntryResponse.from(store.findById(id)));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<List<StatusChangeResponse>> getHistory(@PathVariable("id") UUID id) {
        store.findById(id);
        return ResponseEntity.ok(store.findStatusHistory(id).stream().map(StatusChangeResponse::from).toList());
    }

    @PutMapping("/{id}")
    public ResponseEntity<JournalEntryResponse> updateEntry(
            @PathVariable("id") UUID id,
            @Valid @RequestBody JournalEntryRequest request,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        return ResponseEntity.ok(JournalEntryResponse.from(store.update(id, request, actorId)));
    }

    @PostMapping("/{id}/post")
    public ResponseEntity<JournalEntryResponse> postEntry(
            @PathVariable("id") UUID id,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        return ResponseEntity.ok(JournalEntryResponse.from(store.post(id, actorId)));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<ReversalResponse> reverseEntry(
            @PathVariable("id") UUID id,
            @Valid @RequestBody(required = false) ReverseEntryRequest request,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        Reversal reversal = request != null
            ? store.reverse(id, request.getDate(), request.getReason(), actorId)
            : store.reverse(id, null, null, actorId);
        return ResponseEntity.ok(ReversalResponse.from(reversal));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(
            @PathVariable("id") UUID id,
            @RequestHeader(ACTOR_HEADER) String actorId) {
        store.delete(id, actorId);
        return ResponseEntity.noContent().build();
    }
}
