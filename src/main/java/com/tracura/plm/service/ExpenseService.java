package com.tracura.plm.service;

import com.tracura.plm.domain.DepartmentBudget;
import com.tracura.plm.domain.Expense;
import com.tracura.plm.domain.ExpenseStatus;
import com.tracura.plm.domain.ExpenseSubmission;
import com.tracura.plm.domain.SubmittedExpense;
import com.tracura.plm.domain.ValidationResult;
import com.tracura.plm.handler.ProjectChangePublisher;
import com.tracura.plm.repository.ExpenseRepository;
import com.tracura.plm.repository.PhaseRepository;
import com.tracura.plm.repository.ProjectRepository;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Expense submission and approval.
 * The escalation flag is decided once, at submission, against the figures before the candidate.
 */
@Service
public class ExpenseService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ProjectRepository projectRepository;
    private final PhaseRepository phaseRepository;
    private final ExpenseRepository expenseRepository;
    private final BudgetAggregator budgetAggregator;
    private final EscalationEvaluator escalationEvaluator;
    private final TempApproverService tempApproverService;
    private final ProjectChangePublisher changePublisher;
    private final Clock clock;

    public ExpenseService(
        ProjectRepository projectRepository,
        PhaseRepository phaseRepository,
        ExpenseRepository expenseRepository,
        BudgetAggregator budgetAggregator,
        EscalationEvaluator escalationEvaluator,
        TempApproverService tempApproverService,
        ProjectChangePublisher changePublisher,
        Clock clock
    ) {
        this.projectRepository = projectRepository;
        this.phaseRepository = phaseRepository;
        this.expenseRepository = expenseRepository;
        this.budgetAggregator = budgetAggregator;
        this.escalationEvaluator = escalationEvaluator;
        this.tempApproverService = tempApproverService;
        this.changePublisher = changePublisher;
        this.clock = clock;
    }

    // ========================================================================
    // SUBMIT
    // ========================================================================

    /**
     * Submit an expense against a phase department. The stored expense is PENDING and carries
     * the escalation flag.
     */
    @Transactional
    public Either<ValidationResult, SubmittedExpense> submit(ExpenseSubmission submission) {
        var validation = validate(submission);
        if (!validation.valid()) {
            return Either.left(validation);
        }
        if (projectRepository.findById(submission.projectId()).isEmpty()) {
            return Either.left(ValidationResult.error("NOT_FOUND", "Project not found"));
        }
        var phaseOpt = phaseRepository.findPhase(submission.projectId(), submission.phaseId());
        if (phaseOpt.isEmpty()) {
            return Either.left(ValidationResult.error("PHASE_NOT_FOUND", "Phase not found", "phaseId"));
        }
        var phase = phaseOpt.get();
        if (!phase.enabled()) {
            return Either.left(ValidationResult.error("PHASE_DISABLED", "Phase is disabled", "phaseId"));
        }
        if (!phase.isInTimeline(submission.date())) {
            return Either.left(ValidationResult.error(
                "OUTSIDE_TIMELINE", "Expense date is outside the phase timeline", "date"));
        }

        var departments = Try.of(() -> phaseRepository.findDepartments(submission.projectId(), phase.id()));
        var approved = expenseRepository.findApproved(submission.projectId());
        var phaseBudget = budgetAggregator.aggregate(phase, departments, approved, LocalDate.now(clock));

        var department = phaseBudget.department(submission.department());
        if (department.isEmpty() && !phaseBudget.degraded()) {
            return Either.left(ValidationResult.error(
                "DEPARTMENT_NOT_FOUND", "Department not found in phase", "department"));
        }

        var decision = escalationEvaluator.evaluate(submission.amount(), phaseBudget, department);
        var departmentName = department.map(DepartmentBudget::name).orElse(submission.department().trim());
        var expense = Expense.pending(
            submission.projectId(),
            phase.id(),
            departmentName,
            submission.date(),
            submission.amount(),
            submission.submittedBy(),
            decision.requiresAdmin(),
            LocalDateTime.now(clock)
        );
        var saved = expenseRepository.insert(expense);

        if (decision.requiresAdmin()) {
            log.info("Expense {} on project {} escalated to admin: {}",
                saved.id().orElse("?"), submission.projectId(), decision.reasons());
        } else {
            log.info("Expense {} submitted on project {}", saved.id().orElse("?"), submission.projectId());
        }
        changePublisher.projectUpdated(submission.projectId(), "Expense submitted");
        return Either.right(new SubmittedExpense(saved, decision));
    }

    // ========================================================================
    // DECIDE
    // ========================================================================

    /**
     * Approve or reject a pending expense as the project manager or the active temporary approver.
     * Admin-flagged expenses cannot be approved here.
     */
    @Transactional
    public Either<ValidationResult, Expense> decide(
        String projectId, String expenseId, String userId, ExpenseStatus outcome, String remark
    ) {
        if (outcome != ExpenseStatus.APPROVED && outcome != ExpenseStatus.REJECTED) {
            return Either.left(ValidationResult.error("INVALID_STATUS", "Outcome must be APPROVED or REJECTED", "status"));
        }
        var projectOpt = projectRepository.findById(projectId);
        if (projectOpt.isEmpty()) {
            return Either.left(ValidationResult.error("NOT_FOUND", "Project not found"));
        }
        var project = projectOpt.get();
        var expenseOpt = expenseRepository.findById(projectId, expenseId);
        if (expenseOpt.isEmpty()) {
            return Either.left(ValidationResult.error("EXPENSE_NOT_FOUND", "Expense not found"));
        }
        var expense = expenseOpt.get();

        if (!tempApproverService.canApprove(project, userId)) {
            return Either.left(ValidationResult.error("NOT_AUTHORIZED", "User cannot approve expenses of this project"));
        }
        if (!expense.status().canTransitionTo(outcome)) {
            return Either.left(ValidationResult.error(
                "INVALID_STATE", "Expense is already " + expense.status(), "status"));
        }
        if (outcome == ExpenseStatus.APPROVED && expense.admin()) {
            return Either.left(ValidationResult.error(
                "ADMIN_APPROVAL_REQUIRED", "Expense exceeds budget and must be approved by admin"));
        }

        var trimmed = remark == null || remark.isBlank() ? null : remark.trim();
        var decided = expense.decided(outcome, userId, trimmed, LocalDateTime.now(clock));
        if (!expenseRepository.updateDecision(decided, ExpenseStatus.PENDING)) {
            return Either.left(ValidationResult.error("CONFLICT", "Expense was decided concurrently"));
        }

        var byDelegate = project.isTempApprover(userId)
            && !project.primaryManagerId().map(userId::equals).orElse(false);
        if (outcome == ExpenseStatus.APPROVED && byDelegate) {
            tempApproverService.recordApproval(projectId, userId, expenseId);
        }
        log.info("Expense {} on project {} {} by {}", expenseId, projectId, outcome, userId);
        changePublisher.projectUpdated(projectId, "Expense " + outcome.name().toLowerCase());
        return Either.right(decided);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Validate a submission without touching the store.
     */
    public ValidationResult validate(ExpenseSubmission submission) {
        if (submission.amount() == null || submission.amount().signum() <= 0) {
            return ValidationResult.error("INVALID_AMOUNT", "Amount must be greater than zero", "amount");
        }
        if (submission.phaseId() == null || submission.phaseId().isBlank()) {
            return ValidationResult.error("REQUIRED", "Phase is required", "phaseId");
        }
        if (submission.department() == null || submission.department().isBlank()) {
            return ValidationResult.error("REQUIRED", "Department is required", "department");
        }
        if (submission.date() == null) {
            return ValidationResult.error("REQUIRED", "Expense date is required", "date");
        }
        if (submission.submittedBy() == null || submission.submittedBy().isBlank()) {
            return ValidationResult.error("REQUIRED", "Submitter is required", "submittedBy");
        }
        return ValidationResult.success();
    }
}
