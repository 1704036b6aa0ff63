package com.tracura.plm.api;

import com.tracura.plm.domain.ExpenseStatus;
import com.tracura.plm.domain.ExpenseSubmission;
import com.tracura.plm.service.ExpenseService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;

/**
 * REST API controller for expense submission and approval.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}/expenses")
public class ExpenseController {

    private final ExpenseService expenseService;

    public ExpenseController(ExpenseService expenseService) {
        this.expenseService = expenseService;
    }

    @PostMapping
    public ResponseEntity<?> submit(
        @PathVariable String id,
        @RequestBody ExpenseSubmission submission,
        @RequestHeader("X-User-Id") String userId
    ) {
        // Path and header are authoritative over the body
        var result = expenseService.submit(submission.withProject(id, userId));

        return result.<ResponseEntity<?>>fold(
            error -> ResponseEntity.badRequest().body(error),
            submitted -> ResponseEntity.status(HttpStatus.CREATED).body(submitted)
        );
    }

    @PatchMapping("/{expenseId}/status")
    public ResponseEntity<?> decide(
        @PathVariable String id,
        @PathVariable String expenseId,
        @RequestHeader("X-User-Id") String userId,
        @RequestBody Map<String, String> body
    ) {
        var status = body.get("status");
        if (status == null || status.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "'status' is required"));
        }
        ExpenseStatus outcome;
        try {
            outcome = ExpenseStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }

        var result = expenseService.decide(id, expenseId, userId, outcome, body.get("remark"));
        return result.<ResponseEntity<?>>fold(
            error -> switch (error.errorCode()) {
                case "NOT_FOUND", "EXPENSE_NOT_FOUND" -> ResponseEntity.notFound().build();
                case "NOT_AUTHORIZED" -> ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
                case "CONFLICT" -> ResponseEntity.status(HttpStatus.CONFLICT).body(error);
                default -> ResponseEntity.badRequest().body(error);
            },
            ResponseEntity::ok
        );
    }
}
