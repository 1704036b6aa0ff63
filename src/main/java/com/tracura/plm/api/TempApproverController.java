package com.tracura.plm.api;

import com.tracura.plm.service.TempApproverService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * REST API controller for temporary approver delegation.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}/temp-approver")
public class TempApproverController {

    private final TempApproverService tempApproverService;

    public TempApproverController(TempApproverService tempApproverService) {
        this.tempApproverService = tempApproverService;
    }

    public record AssignRequest(
        String approverId,
        LocalDateTime startDate,
        LocalDateTime endDate
    ) {
    }

    @PostMapping
    public ResponseEntity<?> assign(@PathVariable String id, @RequestBody AssignRequest request) {
        var result = tempApproverService.assign(id, request.approverId(), request.startDate(), request.endDate());
        return result.<ResponseEntity<?>>fold(
            error -> "NOT_FOUND".equals(error.errorCode())
                ? ResponseEntity.notFound().build()
                : ResponseEntity.badRequest().body(error),
            delegation -> ResponseEntity.status(HttpStatus.CREATED).body(delegation)
        );
    }

    /**
     * Current delegation of the project, observed now.
     */
    @GetMapping
    public ResponseEntity<?> current(@PathVariable String id) {
        return tempApproverService.observe(id).<ResponseEntity<?>>fold(
            error -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", error.getMessage())),
            observation -> observation
                .map(o -> ResponseEntity.ok(o.delegation()))
                .orElse(ResponseEntity.notFound().build())
        );
    }

    @PostMapping("/accept")
    public ResponseEntity<?> accept(@PathVariable String id, @RequestHeader("X-User-Id") String userId) {
        var result = tempApproverService.accept(id, userId);
        return result.<ResponseEntity<?>>fold(
            error -> ResponseEntity.badRequest().body(error),
            ResponseEntity::ok
        );
    }

    @PostMapping("/reject")
    public ResponseEntity<?> reject(
        @PathVariable String id,
        @RequestHeader("X-User-Id") String userId,
        @RequestBody Map<String, String> body
    ) {
        var result = tempApproverService.reject(id, userId, body.get("reason"));
        return result.<ResponseEntity<?>>fold(
            error -> ResponseEntity.badRequest().body(error),
            ResponseEntity::ok
        );
    }
}
