package com.tracura.plm.service;

import com.tracura.plm.config.PlmProperties;
import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.TempApprover;
import com.tracura.plm.domain.TempApproverStatus;
import com.tracura.plm.domain.ValidationResult;
import com.tracura.plm.handler.ProjectChangePublisher;
import com.tracura.plm.repository.ProjectRepository;
import com.tracura.plm.repository.TempApproverRepository;
import io.vavr.control.Either;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Temporary approver delegation: assignment, acceptance, rejection and expiry.
 * The stored status is reconciled with the window-derived status whenever a delegation is observed.
 */
@Service
public class TempApproverService {

    private static final Logger log = LoggerFactory.getLogger(TempApproverService.class);

    private final ProjectRepository projectRepository;
    private final TempApproverRepository tempApproverRepository;
    private final ProjectChangePublisher changePublisher;
    private final PlmProperties properties;
    private final Clock clock;

    public TempApproverService(
        ProjectRepository projectRepository,
        TempApproverRepository tempApproverRepository,
        ProjectChangePublisher changePublisher,
        PlmProperties properties,
        Clock clock
    ) {
        this.projectRepository = projectRepository;
        this.tempApproverRepository = tempApproverRepository;
        this.changePublisher = changePublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * A delegation as seen at observation time.
     *
     * @param delegation        the delegation carrying its current status
     * @param storedStatus      status stored before the observation
     * @param statusWritten     the stored status was corrected
     * @param assignmentCleared the project's temporary approver was cleared
     */
    public record Observation(
        TempApprover delegation,
        TempApproverStatus storedStatus,
        boolean statusWritten,
        boolean assignmentCleared
    ) {
        public boolean changedAnything() {
            return statusWritten || assignmentCleared;
        }
    }

    // ========================================================================
    // ASSIGN
    // ========================================================================

    /**
     * Assign a delegate for the given window. The delegation starts PENDING.
     */
    @Transactional
    public Either<ValidationResult, TempApprover> assign(
        String projectId, String approverId, LocalDateTime start, LocalDateTime end
    ) {
        var projectOpt = projectRepository.findById(projectId);
        if (projectOpt.isEmpty()) {
            return Either.left(ValidationResult.error("NOT_FOUND", "Project not found"));
        }
        var project = projectOpt.get();
        var now = LocalDateTime.now(clock);

        var validation = validateWindow(project, approverId, start, end, now);
        if (!validation.valid()) {
            return Either.left(validation);
        }

        var existing = project.tempApproverId();
        if (existing.isPresent()) {
            var live = tempApproverRepository.find(projectId, existing.get())
                .map(d -> !d.currentStatus(now).isTerminal())
                .orElse(false);
            if (live) {
                return Either.left(ValidationResult.error(
                    "DELEGATION_EXISTS", "Project already has a temporary approver", "approverId"));
            }
            projectRepository.clearTempApprover(projectId, existing.get());
        }

        if (!projectRepository.assignTempApprover(projectId, approverId, now)) {
            return Either.left(ValidationResult.error("CONFLICT", "Project delegation changed concurrently"));
        }
        var saved = tempApproverRepository.insert(TempApprover.pending(projectId, approverId, start, end, now));
        log.info("Assigned temporary approver {} to project {} ({} - {})", approverId, projectId, start, end);
        changePublisher.projectUpdated(projectId, "Temporary approver assigned");
        return Either.right(saved);
    }

    // ========================================================================
    // OBSERVE
    // ========================================================================

    /**
     * Load and observe the delegation currently assigned to the project.
     */
    public Try<Optional<Observation>> observe(String projectId) {
        return Try.of(() -> projectRepository.findById(projectId))
            .flatMap(project -> project.map(this::observe).orElseGet(() -> Try.success(Optional.empty())));
    }

    /**
     * Observe the project's delegation at the current time: the stored status is brought in line
     * with the window, and a delegation observed REJECTED or EXPIRED is unassigned from the project.
     */
    public Try<Optional<Observation>> observe(Project project) {
        return readDelegation(project).map(found -> settle(project, found));
    }

    /**
     * Read the delegation named by the project without writing anything.
     */
    public Try<Optional<TempApprover>> readDelegation(Project project) {
        return project.tempApproverId()
            .map(approverId -> Try.of(() -> tempApproverRepository.find(project.id(), approverId)))
            .orElseGet(() -> Try.success(Optional.empty()));
    }

    /**
     * Apply the corrective writes for a delegation previously read with {@link #readDelegation}.
     * A project naming a delegation that no longer exists has the reference cleared.
     */
    public Optional<Observation> settle(Project project, Optional<TempApprover> delegation) {
        if (project.tempApproverId().isEmpty()) {
            return Optional.empty();
        }
        var approverId = project.tempApproverId().get();
        if (delegation.isEmpty()) {
            log.warn("Project {} references missing delegation of {}, clearing", project.id(), approverId);
            projectRepository.clearTempApprover(project.id(), approverId);
            return Optional.empty();
        }
        return Optional.of(reconcile(project.id(), delegation.get()));
    }

    // ========================================================================
    // DELEGATE ACTIONS
    // ========================================================================

    /**
     * Delegate accepts. The stored status becomes ACCEPTED, or ACTIVE when the window has started.
     */
    @Transactional
    public Either<ValidationResult, TempApprover> accept(String projectId, String approverId) {
        var lookup = findAssigned(projectId, approverId);
        if (lookup.isLeft()) {
            return Either.left(lookup.getLeft());
        }
        var delegation = lookup.get();
        var now = LocalDateTime.now(clock);

        if (delegation.status() != TempApproverStatus.PENDING) {
            return Either.left(ValidationResult.error(
                "INVALID_STATE", "Delegation is " + delegation.status() + ", only PENDING can be accepted"));
        }
        if (delegation.currentStatus(now) == TempApproverStatus.EXPIRED) {
            return Either.left(ValidationResult.error("EXPIRED", "Delegation window has ended"));
        }

        var target = TempApproverStatus.currentStatus(
            TempApproverStatus.ACCEPTED, delegation.startDate(), delegation.endDate(), now);
        if (!tempApproverRepository.updateStatus(projectId, approverId, TempApproverStatus.PENDING, target, null, now)) {
            return Either.left(ValidationResult.error("CONFLICT", "Delegation changed concurrently"));
        }
        log.info("Temporary approver {} accepted delegation on project {} as {}", approverId, projectId, target);
        changePublisher.projectUpdated(projectId, "Temporary approver accepted");
        return Either.right(delegation.withStatus(target, now));
    }

    /**
     * Delegate rejects with a mandatory reason; the project assignment is cleared at once.
     */
    @Transactional
    public Either<ValidationResult, TempApprover> reject(String projectId, String approverId, String reason) {
        if (reason == null || reason.isBlank()) {
            return Either.left(ValidationResult.error("REASON_REQUIRED", "Rejection reason is required", "reason"));
        }
        var lookup = findAssigned(projectId, approverId);
        if (lookup.isLeft()) {
            return Either.left(lookup.getLeft());
        }
        var delegation = lookup.get();
        var now = LocalDateTime.now(clock);

        if (delegation.status() != TempApproverStatus.PENDING) {
            return Either.left(ValidationResult.error(
                "INVALID_STATE", "Delegation is " + delegation.status() + ", only PENDING can be rejected"));
        }
        var trimmed = reason.trim();
        if (!tempApproverRepository.updateStatus(
            projectId, approverId, TempApproverStatus.PENDING, TempApproverStatus.REJECTED, trimmed, now)) {
            return Either.left(ValidationResult.error("CONFLICT", "Delegation changed concurrently"));
        }
        projectRepository.clearTempApprover(projectId, approverId);
        log.info("Temporary approver {} rejected delegation on project {}", approverId, projectId);
        changePublisher.projectUpdated(projectId, "Temporary approver rejected");
        return Either.right(delegation.rejected(trimmed, now));
    }

    // ========================================================================
    // AUTHORITY
    // ========================================================================

    /**
     * Whether {@code userId} may approve expenses of the project: the manager, or the assigned
     * delegate while its current status is ACCEPTED or ACTIVE.
     */
    public boolean canApprove(Project project, String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        if (project.primaryManagerId().map(userId::equals).orElse(false)) {
            return true;
        }
        if (!project.isTempApprover(userId)) {
            return false;
        }
        var now = LocalDateTime.now(clock);
        return tempApproverRepository.find(project.id(), userId)
            .map(d -> d.currentStatus(now).grantsAuthority())
            .orElse(false);
    }

    /**
     * @return Optional.empty() if the project does not exist
     */
    public Optional<Boolean> canApprove(String projectId, String userId) {
        return projectRepository.findById(projectId).map(project -> canApprove(project, userId));
    }

    /**
     * Record an expense approved under the delegate's authority.
     */
    public void recordApproval(String projectId, String approverId, String expenseId) {
        tempApproverRepository.find(projectId, approverId)
            .flatMap(TempApprover::id)
            .ifPresentOrElse(
                id -> tempApproverRepository.addApprovedExpense(id, expenseId),
                () -> log.warn("No delegation of {} on project {} to record expense {}", approverId, projectId, expenseId)
            );
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private ValidationResult validateWindow(
        Project project, String approverId, LocalDateTime start, LocalDateTime end, LocalDateTime now
    ) {
        if (approverId == null || approverId.isBlank()) {
            return ValidationResult.error("REQUIRED", "Approver is required", "approverId");
        }
        if (project.primaryManagerId().map(approverId::equals).orElse(false)) {
            return ValidationResult.error("SELF_DELEGATION", "Manager cannot be their own temporary approver", "approverId");
        }
        if (start == null || end == null) {
            return ValidationResult.error("REQUIRED", "Start and end date are required", "startDate");
        }
        if (start.toLocalDate().isBefore(now.toLocalDate())) {
            return ValidationResult.error("INVALID_START", "Start date cannot be in the past", "startDate");
        }
        if (!end.isAfter(start)) {
            return ValidationResult.error("INVALID_END", "End date must be after start date", "endDate");
        }
        var maxDays = properties.delegation().maxWindowDays();
        if (Duration.between(start, end).compareTo(Duration.ofDays(maxDays)) > 0) {
            return ValidationResult.error(
                "WINDOW_TOO_LONG", "Delegation cannot exceed " + maxDays + " days", "endDate");
        }
        return ValidationResult.success();
    }

    private Either<ValidationResult, TempApprover> findAssigned(String projectId, String approverId) {
        var project = projectRepository.findById(projectId);
        if (project.isEmpty()) {
            return Either.left(ValidationResult.error("NOT_FOUND", "Project not found"));
        }
        if (!project.get().isTempApprover(approverId)) {
            return Either.left(ValidationResult.error("NOT_ASSIGNED", "User is not the temporary approver of this project"));
        }
        return tempApproverRepository.find(projectId, approverId)
            .<Either<ValidationResult, TempApprover>>map(Either::right)
            .orElseGet(() -> Either.left(ValidationResult.error("NOT_FOUND", "Delegation not found")));
    }

    private Observation reconcile(String projectId, TempApprover delegation) {
        var now = LocalDateTime.now(clock);
        var stored = delegation.status();
        var current = delegation.currentStatus(now);

        var written = false;
        if (current != stored) {
            written = tempApproverRepository.updateStatus(
                projectId, delegation.approverId(), stored, current, null, now);
            if (written) {
                log.info("Delegation of {} on project {}: {} -> {}", delegation.approverId(), projectId, stored, current);
            } else {
                log.warn("State conflict updating delegation of {} on project {}, left for next pass",
                    delegation.approverId(), projectId);
            }
        }

        var cleared = false;
        if (current.isTerminal()) {
            cleared = projectRepository.clearTempApprover(projectId, delegation.approverId());
            if (cleared) {
                log.info("Cleared {} delegation of {} from project {}", current, delegation.approverId(), projectId);
            }
        }
        return new Observation(delegation.withStatus(current, now), stored, written, cleared);
    }
}
