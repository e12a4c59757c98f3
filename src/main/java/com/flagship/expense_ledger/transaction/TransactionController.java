package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.reconciliation.ReconciliationSessionFactory;
import com.flagship.expense_ledger.transaction.dto.TransactionDetailsResponse;
import com.flagship.expense_ledger.transaction.dto.TransactionRequest;
import com.flagship.expense_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for transactions.
 *
 * The acting user comes from the X-User-Id header. POST accepts an optional
 * Idempotency-Key header: a repeated key answers 200 with the transaction created by
 * the first request instead of 201 with a new one. Successful writes are applied to the
 * actor's open sync sessions right away.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionService transactionService;
    private final TransactionQueryService queryService;
    private final ReconciliationSessionFactory sessionFactory;

    @PostMapping
    public ResponseEntity<TransactionResponse> create(
            @RequestHeader(USER_ID_HEADER) UUID actor,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody TransactionRequest request) {

        log.info("Received transaction create request: type={}, amount={}, idempotencyKey={}",
                request.type(), request.amount(), idempotencyKey);

        TransactionService.CreateResult result = transactionService.create(actor, request.toDraft(), idempotencyKey);
        if (result.created()) {
            sessionFactory.applyLocalWrite(actor, result.transaction(), true);
        }
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(TransactionResponse.from(result.transaction()));
    }

    @PutMapping("/{id}")
    public TransactionResponse update(
            @RequestHeader(USER_ID_HEADER) UUID actor,
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransactionRequest request) {
        Transaction updated = transactionService.update(actor, id, request.toDraft());
        sessionFactory.applyLocalWrite(actor, updated, false);
        return TransactionResponse.from(updated);
    }

    @DeleteMapping("/{id}")
    public TransactionResponse delete(
            @RequestHeader(USER_ID_HEADER) UUID actor,
            @PathVariable("id") UUID id) {
        Transaction deleted = transactionService.delete(actor, id);
        sessionFactory.applyLocalDelete(actor, id);
        return TransactionResponse.from(deleted);
    }

    @GetMapping("/{id}")
    public TransactionDetailsResponse get(@PathVariable("id") UUID id) {
        return TransactionDetailsResponse.from(queryService.get(id));
    }

    @GetMapping
    public List<TransactionResponse> list(
            @RequestHeader(USER_ID_HEADER) UUID actor,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "include_deleted", defaultValue = "false") boolean includeDeleted) {

        TransactionFilter filter = TransactionFilter.builder()
            .from(from)
            .to(to)
            .type(type != null ? TransactionType.fromValue(type) : null)
            .includeDeleted(includeDeleted)
            .build();
        return queryService.list(actor, filter).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
