package com.tracura.plm.api;

import com.tracura.plm.domain.ContractorMode;
import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.DepartmentLineItem;
import com.tracura.plm.domain.ReconciliationResult;
import com.tracura.plm.service.PhaseService;
import com.tracura.plm.service.ProjectReconciliationService;
import com.tracura.plm.service.TempApproverService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * REST API controller for project budgets, reconciliation and phase maintenance.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final ProjectReconciliationService reconciliationService;
    private final TempApproverService tempApproverService;
    private final PhaseService phaseService;

    public ProjectController(
        ProjectReconciliationService reconciliationService,
        TempApproverService tempApproverService,
        PhaseService phaseService
    ) {
        this.reconciliationService = reconciliationService;
        this.tempApproverService = tempApproverService;
        this.phaseService = phaseService;
    }

    public record DepartmentRequest(
        String name,
        String contractorMode,
        List<DepartmentLineItem> lineItems
    ) {
    }

    // ========================================================================
    // BUDGET
    // ========================================================================

    @GetMapping("/{id}/budget")
    public ResponseEntity<?> getBudget(@PathVariable String id) {
        var result = reconciliationService.loadProjectBudget(id);
        if (result.isFailure() && result.getCause() instanceof NoSuchElementException) {
            return ResponseEntity.notFound().build();
        }
        return result.<ResponseEntity<?>>fold(
            error -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", error.getMessage())),
            ResponseEntity::ok
        );
    }

    // ========================================================================
    // RECONCILIATION
    // ========================================================================

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResult> reconcileAll() {
        return ResponseEntity.ok(reconciliationService.reconcileAll());
    }

    @PostMapping("/{id}/reconcile")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable String id) {
        return ResponseEntity.ok(reconciliationService.reconcileProject(id));
    }

    @GetMapping("/{id}/approvers/{userId}")
    public ResponseEntity<?> canApprove(@PathVariable String id, @PathVariable String userId) {
        return tempApproverService.canApprove(id, userId)
            .map(canApprove -> ResponseEntity.ok(Map.of("canApprove", canApprove)))
            .orElse(ResponseEntity.notFound().build());
    }

    // ========================================================================
    // PHASES
    // ========================================================================

    @PostMapping("/{id}/phases/{phaseId}/departments")
    public ResponseEntity<?> addDepartment(
        @PathVariable String id,
        @PathVariable String phaseId,
        @RequestBody DepartmentRequest request
    ) {
        if (request.name() == null || request.name().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "'name' is required"));
        }
        var department = Department.of(
            id, phaseId, request.name().trim(), ContractorMode.fromLabel(request.contractorMode()), request.lineItems());

        var result = phaseService.addDepartment(id, phaseId, department);
        return result.<ResponseEntity<?>>fold(
            error -> ResponseEntity.badRequest().body(error),
            ResponseEntity::ok
        );
    }

    @DeleteMapping("/{id}/phases/{phaseId}")
    public ResponseEntity<?> deletePhase(@PathVariable String id, @PathVariable String phaseId) {
        var result = phaseService.deletePhase(id, phaseId);
        return result.<ResponseEntity<?>>fold(
            error -> "PHASE_NOT_FOUND".equals(error.errorCode())
                ? ResponseEntity.notFound().build()
                : ResponseEntity.badRequest().body(error),
            ResponseEntity::ok
        );
    }
}
