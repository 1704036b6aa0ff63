package com.tracura.plm.service;

import com.tracura.plm.domain.Phase;
import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectStatus;
import com.tracura.plm.repository.StoreDates;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProjectStatusEvaluator.
 */
class ProjectStatusEvaluatorTests {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private final ProjectStatusEvaluator evaluator = new ProjectStatusEvaluator();
    private final BudgetAggregator aggregator = new BudgetAggregator();

    private static Project project(ProjectStatus status) {
        return Project.inReview("P-1", "Villa", TODAY.minusMonths(2), "manager-1")
            .withStatus(status, LocalDateTime.of(2024, 6, 1, 9, 0));
    }

    @Test
    void active_withPhaseStartedYesterdayAndOpenEnd_staysActive() {
        var phases = List.of(Phase.of("PH-1", "P-1", 1, TODAY.minusDays(1), null));

        var transition = evaluator.evaluate(project(ProjectStatus.ACTIVE), aggregator.hasActivePhase(phases, TODAY), TODAY);

        assertTrue(transition.isEmpty());
    }

    @Test
    void active_withPhaseEndedYesterday_movesToStandby() {
        var phases = List.of(Phase.of("PH-1", "P-1", 1, TODAY.minusDays(30), TODAY.minusDays(1)));

        var transition = evaluator.evaluate(project(ProjectStatus.ACTIVE), aggregator.hasActivePhase(phases, TODAY), TODAY)
            .orElseThrow();

        assertEquals(ProjectStatus.ACTIVE, transition.from());
        assertEquals(ProjectStatus.STANDBY, transition.to());
        assertFalse(transition.unsuspend());
    }

    @Test
    void active_withOnlyDisabledPhase_movesToStandby() {
        var phases = List.of(Phase.of("PH-1", "P-1", 1, null, null).withEnabled(false));

        var transition = evaluator.evaluate(project(ProjectStatus.ACTIVE), aggregator.hasActivePhase(phases, TODAY), TODAY);

        assertEquals(ProjectStatus.STANDBY, transition.orElseThrow().to());
    }

    @ParameterizedTest
    @CsvSource({
        "2024-06-15, ACTIVE",
        "2024-12-31, ACTIVE",
        "2025-01-01, MAINTENANCE"
    })
    void standby_withActivePhase_dependsOnHandover(String today, String expected) {
        var day = LocalDate.parse(today);
        var handover = StoreDates.parse("31/12/2024").orElseThrow();
        var standby = project(ProjectStatus.STANDBY).withDates(TODAY.minusMonths(2), handover, null);

        var transition = evaluator.evaluate(standby, true, day).orElseThrow();

        assertEquals(ProjectStatus.valueOf(expected), transition.to());
    }

    @Test
    void standby_withoutHandover_becomesActive() {
        var transition = evaluator.evaluate(project(ProjectStatus.STANDBY), true, TODAY).orElseThrow();

        assertEquals(ProjectStatus.ACTIVE, transition.to());
    }

    @Test
    void standby_withoutActivePhase_isStable() {
        assertTrue(evaluator.evaluate(project(ProjectStatus.STANDBY), false, TODAY).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, names = {"ACTIVE", "STANDBY"}, mode = EnumSource.Mode.EXCLUDE)
    void otherStatuses_areStable(ProjectStatus status) {
        assertTrue(evaluator.evaluate(project(status), true, TODAY).isEmpty());
        assertTrue(evaluator.evaluate(project(status), false, TODAY).isEmpty());
    }

    @Test
    void suspended_neverMovesAutomatically() {
        var suspended = project(ProjectStatus.ACTIVE).suspendedUntil(TODAY.plusDays(5), "Permit");

        assertTrue(evaluator.evaluate(suspended, false, TODAY).isEmpty());
        assertTrue(evaluator.evaluate(suspended, true, TODAY).isEmpty());
    }

    @Test
    void unsuspend_afterSuspendedDateWithPlannedDateReached_resumesActive() {
        var suspended = project(ProjectStatus.ACTIVE).suspendedUntil(TODAY.minusDays(1), "Permit");

        var transition = evaluator.evaluateUnsuspend(suspended, TODAY).orElseThrow();

        assertTrue(transition.unsuspend());
        assertEquals(ProjectStatus.SUSPENDED, transition.from());
        assertEquals(ProjectStatus.ACTIVE, transition.to());
    }

    @Test
    void unsuspend_withFuturePlannedDate_locks() {
        var suspended = project(ProjectStatus.ACTIVE)
            .withDates(TODAY.plusDays(3), null, null)
            .suspendedUntil(TODAY.minusDays(1), "Permit");

        assertEquals(ProjectStatus.LOCKED, evaluator.evaluateUnsuspend(suspended, TODAY).orElseThrow().to());
    }

    @Test
    void unsuspend_withoutPlannedDate_locks() {
        var suspended = project(ProjectStatus.ACTIVE)
            .withDates(null, null, null)
            .suspendedUntil(TODAY.minusDays(1), "Permit");

        assertEquals(ProjectStatus.LOCKED, evaluator.evaluateUnsuspend(suspended, TODAY).orElseThrow().to());
    }

    @Test
    void unsuspend_notBeforeSuspendedDateHasPassed() {
        var suspendedToday = project(ProjectStatus.ACTIVE).suspendedUntil(TODAY, "Permit");

        assertTrue(evaluator.evaluateUnsuspend(suspendedToday, TODAY).isEmpty());
        assertTrue(evaluator.evaluateUnsuspend(project(ProjectStatus.ACTIVE), TODAY).isEmpty());
    }
}
