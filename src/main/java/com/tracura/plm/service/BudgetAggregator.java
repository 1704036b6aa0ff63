package com.tracura.plm.service;

import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.DepartmentBudget;
import com.tracura.plm.domain.DepartmentKey;
import com.tracura.plm.domain.Expense;
import com.tracura.plm.domain.Phase;
import com.tracura.plm.domain.PhaseBudget;
import com.tracura.plm.domain.ProjectBudget;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives allocated, approved and remaining figures for phases and departments.
 * Pure over its inputs; only approved expenses are counted.
 */
@Component
public class BudgetAggregator {

    private static final Logger log = LoggerFactory.getLogger(BudgetAggregator.class);

    // ========================================================================
    // PHASE LEVEL
    // ========================================================================

    /**
     * Aggregate one phase.
     * When the department load failed or returned nothing the legacy budget map is used instead
     * and the result is flagged degraded.
     */
    public PhaseBudget aggregate(
        Phase phase, Try<List<Department>> departments, List<Expense> approvedExpenses, LocalDate today
    ) {
        var phaseExpenses = approvedExpenses.stream()
            .filter(Expense::isApproved)
            .filter(e -> e.phaseId().map(phase.id()::equals).orElse(false))
            .toList();
        var approvedAmount = sum(phaseExpenses.stream().map(Expense::amount).toList());
        var approvedByKey = phaseExpenses.stream()
            .collect(Collectors.groupingBy(Expense::departmentKey,
                Collectors.reducing(BigDecimal.ZERO, Expense::amount, BigDecimal::add)));

        var loaded = departments
            .onFailure(e -> log.warn("Department load failed for phase {}: {}", phase.id(), e.getMessage()))
            .getOrElse(List.of());
        var degraded = loaded.isEmpty();

        List<DepartmentBudget> rows;
        BigDecimal totalBudget;
        if (degraded) {
            if (departments.isSuccess()) {
                log.debug("Phase {} has no departments, using legacy budget map", phase.id());
            }
            rows = legacyRows(phase, approvedByKey);
            totalBudget = phase.legacyTotalBudget();
        } else {
            rows = loaded.stream()
                .map(d -> DepartmentBudget.of(
                    d.name(), d.key(), d.allocatedBudget(),
                    approvedByKey.getOrDefault(d.key(), BigDecimal.ZERO)))
                .sorted(Comparator.comparing(DepartmentBudget::name))
                .toList();
            totalBudget = sum(loaded.stream().map(Department::allocatedBudget).toList());
        }

        return new PhaseBudget(
            phase.id(),
            phase.phaseName(),
            phase.phaseNumber(),
            totalBudget,
            approvedAmount,
            totalBudget.subtract(approvedAmount),
            phase.enabled(),
            phase.isInTimeline(today),
            degraded,
            rows
        );
    }

    // ========================================================================
    // PROJECT LEVEL
    // ========================================================================

    /**
     * Roll phase figures up to the project.
     * Approved expenses whose phase is missing or unknown still count toward the project total.
     */
    public ProjectBudget summarize(String projectId, List<PhaseBudget> phases, List<Expense> approvedExpenses) {
        var phaseIds = phases.stream().map(PhaseBudget::phaseId).collect(Collectors.toSet());
        var approved = approvedExpenses.stream().filter(Expense::isApproved).toList();

        var totalBudget = sum(phases.stream().map(PhaseBudget::totalBudget).toList());
        var approvedAmount = sum(approved.stream().map(Expense::amount).toList());
        var unattributed = sum(approved.stream()
            .filter(e -> !isAttributed(e, phaseIds))
            .map(Expense::amount)
            .toList());
        var ordered = phases.stream()
            .sorted(Comparator.comparingInt(PhaseBudget::phaseNumber))
            .toList();

        return new ProjectBudget(
            projectId,
            totalBudget,
            approvedAmount,
            totalBudget.subtract(approvedAmount),
            unattributed,
            phases.stream().anyMatch(PhaseBudget::degraded),
            ordered
        );
    }

    /**
     * At least one enabled phase contains {@code today}.
     */
    public boolean hasActivePhase(List<Phase> phases, LocalDate today) {
        return phases.stream().anyMatch(p -> p.isActiveOn(today));
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private List<DepartmentBudget> legacyRows(Phase phase, Map<String, BigDecimal> approvedByKey) {
        return phase.legacyBudgets().entrySet().stream()
            .map(entry -> {
                var key = DepartmentKey.normalize(phase.id(), entry.getKey());
                var name = key.substring(phase.id().length() + 1);
                return DepartmentBudget.of(name, key, entry.getValue(),
                    approvedByKey.getOrDefault(key, BigDecimal.ZERO));
            })
            .sorted(Comparator.comparing(DepartmentBudget::name))
            .toList();
    }

    private static boolean isAttributed(Expense expense, Set<String> phaseIds) {
        return expense.phaseId().map(phaseIds::contains).orElse(false);
    }

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
