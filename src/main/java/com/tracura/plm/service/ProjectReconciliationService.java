package com.tracura.plm.service;

import com.tracura.plm.config.PlmProperties;
import com.tracura.plm.domain.Phase;
import com.tracura.plm.domain.PhaseBudget;
import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectBudget;
import com.tracura.plm.domain.ReconciliationResult;
import com.tracura.plm.domain.StatusTransition;
import com.tracura.plm.domain.TempApproverStatus;
import com.tracura.plm.handler.ProjectChangePublisher;
import com.tracura.plm.repository.ExpenseRepository;
import com.tracura.plm.repository.PhaseRepository;
import com.tracura.plm.repository.ProjectRepository;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reconciliation driver. Derives project status and delegation state from current data and
 * issues conditional corrective writes, each followed by one change notification.
 * Passes are not transactional: a write that loses a race is skipped and picked up by the next pass.
 */
@Service
public class ProjectReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ProjectReconciliationService.class);

    private final ProjectRepository projectRepository;
    private final PhaseRepository phaseRepository;
    private final ExpenseRepository expenseRepository;
    private final BudgetAggregator budgetAggregator;
    private final ProjectStatusEvaluator statusEvaluator;
    private final TempApproverService tempApproverService;
    private final ProjectChangePublisher changePublisher;
    private final ExecutorService executor;
    private final PlmProperties properties;
    private final Clock clock;

    public ProjectReconciliationService(
        ProjectRepository projectRepository,
        PhaseRepository phaseRepository,
        ExpenseRepository expenseRepository,
        BudgetAggregator budgetAggregator,
        ProjectStatusEvaluator statusEvaluator,
        TempApproverService tempApproverService,
        ProjectChangePublisher changePublisher,
        @Qualifier("reconciliationExecutor") ExecutorService executor,
        PlmProperties properties,
        Clock clock
    ) {
        this.projectRepository = projectRepository;
        this.phaseRepository = phaseRepository;
        this.expenseRepository = expenseRepository;
        this.budgetAggregator = budgetAggregator;
        this.statusEvaluator = statusEvaluator;
        this.tempApproverService = tempApproverService;
        this.changePublisher = changePublisher;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // PROJECT LIST REFRESH
    // ========================================================================

    /**
     * Reconcile every stored project.
     */
    public ReconciliationResult reconcileAll() {
        return Try.of(projectRepository::findAll)
            .map(this::reconcileProjects)
            .recover(e -> {
                log.warn("Project list could not be read, reconciliation abandoned: {}", e.getMessage());
                return ReconciliationResult.failed("Project list: " + e.getMessage());
            })
            .get();
    }

    /**
     * Reconcile the given projects. A failure on one project never affects the others.
     */
    public ReconciliationResult reconcileProjects(List<Project> projects) {
        var result = projects.stream()
            .map(project -> Try.of(() -> phaseRepository.findPhases(project.id()))
                .map(phases -> reconcile(project, phases))
                .recover(e -> abandoned(project.id(), e)))
            .map(Try::get)
            .reduce(ReconciliationResult.empty(), ReconciliationResult::merge);
        if (result.isNoOp()) {
            log.debug("Reconciled {} project(s), nothing to correct", result.projectsChecked());
        } else {
            log.info("Reconciled {} project(s): {} transition(s), {} expired delegation(s), {} conflict(s)",
                result.projectsChecked(), result.transitions().size(),
                result.expiredDelegations().size(), result.conflicts().size());
        }
        return result;
    }

    /**
     * Reconcile a single project by id, as triggered by a change notification.
     */
    public ReconciliationResult reconcileProject(String projectId) {
        return Try.of(() -> projectRepository.findById(projectId))
            .map(project -> project
                .map(p -> reconcileProjects(List.of(p)))
                .orElseGet(() -> {
                    log.warn("Project {} not found, nothing to reconcile", projectId);
                    return ReconciliationResult.empty();
                }))
            .recover(e -> abandoned(projectId, e))
            .get();
    }

    // ========================================================================
    // PHASE LOAD
    // ========================================================================

    /**
     * Load the budget figures of a project, aggregating phases concurrently, and run the status
     * pass with the resulting phase activity.
     */
    public Try<ProjectBudget> loadProjectBudget(String projectId) {
        return Try.of(() -> {
            var project = projectRepository.findById(projectId)
                .orElseThrow(() -> new NoSuchElementException("Project not found: " + projectId));
            var phases = phaseRepository.findPhases(projectId);
            var approved = expenseRepository.findApproved(projectId);
            var today = LocalDate.now(clock);

            var futures = phases.stream()
                .map(phase -> CompletableFuture.supplyAsync(() -> budgetAggregator.aggregate(
                    phase,
                    Try.of(() -> phaseRepository.findDepartments(projectId, phase.id())),
                    approved,
                    today
                ), executor))
                .toList();
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(properties.reconciliation().phaseLoadTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw e;
            } catch (Exception e) {
                futures.forEach(f -> f.cancel(true));
                throw e;
            }
            List<PhaseBudget> phaseBudgets = futures.stream().map(CompletableFuture::join).toList();
            var budget = budgetAggregator.summarize(projectId, phaseBudgets, approved);
            if (budget.degraded()) {
                log.warn("Project {} budget is degraded, some phases use legacy figures", projectId);
            }

            var statusPass = Try.of(() -> reconcile(project, phases))
                .recover(e -> abandoned(projectId, e))
                .get();
            if (!statusPass.conflicts().isEmpty() || statusPass.hasErrors()) {
                log.warn("Status pass after budget load of project {}: conflicts={}, errors={}",
                    projectId, statusPass.conflicts(), statusPass.errors());
            }
            return budget;
        }).onFailure(e -> log.warn("Budget load for project {} failed: {}", projectId, e.getMessage()));
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    /**
     * One pass over a project whose phases are already read. Every read completes before the
     * first write, so a read failure leaves the project untouched. A lifted suspension ends the
     * status pass; the next one runs on the notification it emits.
     */
    private ReconciliationResult reconcile(Project project, List<Phase> phases) {
        var delegation = tempApproverService.readDelegation(project).get();

        var today = LocalDate.now(clock);
        var now = LocalDateTime.now(clock);
        var transitions = new ArrayList<StatusTransition>();
        var conflicts = new ArrayList<String>();
        var expired = new ArrayList<String>();
        var errors = new ArrayList<String>();

        var transition = statusEvaluator.evaluateUnsuspend(project, today)
            .or(() -> statusEvaluator.evaluate(project, budgetAggregator.hasActivePhase(phases, today), today));
        transition.ifPresent(t -> apply(t, now, transitions, conflicts));

        Try.of(() -> tempApproverService.settle(project, delegation))
            .onFailure(e -> {
                log.warn("Delegation of project {} could not be updated: {}", project.id(), e.getMessage());
                errors.add(project.id() + ": " + e.getMessage());
            })
            .forEach(observation -> observation.ifPresent(o -> {
                if (o.assignmentCleared() && o.delegation().status() == TempApproverStatus.EXPIRED) {
                    expired.add(project.id() + "/" + o.delegation().approverId());
                }
                if (o.changedAnything()) {
                    changePublisher.projectUpdated(project.id(),
                        "Delegation " + o.storedStatus() + " -> " + o.delegation().status());
                }
            }));

        return new ReconciliationResult(1, transitions, expired, conflicts, errors);
    }

    private void apply(StatusTransition t, LocalDateTime now, List<StatusTransition> fired, List<String> conflicts) {
        var written = t.unsuspend()
            ? projectRepository.unsuspend(t.projectId(), t.expectedStatus(), t.to(), now)
            : projectRepository.updateStatus(t.projectId(), t.expectedStatus(), t.to(), now);
        if (written) {
            log.info("Project {} status {} -> {} ({})", t.projectId(), t.from(), t.to(), t.reason());
            fired.add(t);
            changePublisher.projectUpdated(t.projectId(), t.reason());
        } else {
            log.warn("State conflict on project {}: expected {}, skipping {}", t.projectId(), t.from(), t.to());
            conflicts.add(t.projectId());
        }
    }

    private ReconciliationResult abandoned(String projectId, Throwable e) {
        log.warn("Reconciliation of project {} abandoned: {}", projectId, e.getMessage());
        return ReconciliationResult.failed(projectId + ": " + e.getMessage());
    }
}
