package com.tracura.plm.service;

import com.tracura.plm.config.PlmProperties;
import com.tracura.plm.domain.ContractorMode;
import com.tracura.plm.domain.Department;
import com.tracura.plm.domain.DepartmentLineItem;
import com.tracura.plm.domain.Expense;
import com.tracura.plm.domain.Phase;
import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectStatus;
import com.tracura.plm.domain.TempApprover;
import com.tracura.plm.domain.TempApproverStatus;
import com.tracura.plm.handler.ProjectChangePublisher;
import com.tracura.plm.repository.ExpenseRepository;
import com.tracura.plm.repository.PhaseRepository;
import com.tracura.plm.repository.ProjectRepository;
import io.vavr.control.Try;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProjectReconciliationService.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectReconciliationServiceTests {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 10, 0);
    private static final LocalDate TODAY = NOW.toLocalDate();

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private PhaseRepository phaseRepository;

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private TempApproverService tempApproverService;

    @Mock
    private ProjectChangePublisher changePublisher;

    private ExecutorService executor;
    private ProjectReconciliationService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        var clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new ProjectReconciliationService(
            projectRepository,
            phaseRepository,
            expenseRepository,
            new BudgetAggregator(),
            new ProjectStatusEvaluator(),
            tempApproverService,
            changePublisher,
            executor,
            PlmProperties.defaults(),
            clock
        );
        when(tempApproverService.readDelegation(any(Project.class))).thenReturn(Try.success(Optional.empty()));
        when(tempApproverService.settle(any(Project.class), any())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ========================================================================
    // Test Data Builders
    // ========================================================================

    private static Project project(String id, ProjectStatus status) {
        return Project.inReview(id, "Project " + id, TODAY.minusMonths(3), "manager-1")
            .withStatus(status, NOW.minusDays(10));
    }

    private static Phase endedPhase(String projectId) {
        return Phase.of("PH-1", projectId, 1, TODAY.minusDays(40), TODAY.minusDays(1));
    }

    private static Phase runningPhase(String projectId) {
        return Phase.of("PH-2", projectId, 2, TODAY.minusDays(1), null);
    }

    // ========================================================================
    // Project list refresh
    // ========================================================================

    @Test
    void activeProjectWithoutActivePhase_movesToStandbyAndNotifiesOnce() {
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(projectRepository.updateStatus("P-1", "ACTIVE", ProjectStatus.STANDBY, NOW)).thenReturn(true);

        var result = service.reconcileProjects(List.of(project("P-1", ProjectStatus.ACTIVE)));

        assertEquals(1, result.transitions().size());
        assertEquals(ProjectStatus.STANDBY, result.transitions().get(0).to());
        verify(changePublisher, times(1)).projectUpdated(eq("P-1"), anyString());
    }

    @Test
    void activeProjectWithRunningPhase_isLeftAlone() {
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1"), runningPhase("P-1")));

        var result = service.reconcileProjects(List.of(project("P-1", ProjectStatus.ACTIVE)));

        assertTrue(result.isNoOp());
        verify(projectRepository, never()).updateStatus(any(), any(), any(), any());
        verifyNoInteractions(changePublisher);
    }

    @Test
    void secondPassOverConsistentState_isNoOp() {
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(projectRepository.updateStatus(any(), any(), any(), any())).thenReturn(true);
        var active = project("P-1", ProjectStatus.ACTIVE);

        var first = service.reconcileProjects(List.of(active));
        var second = service.reconcileProjects(List.of(active.withStatus(ProjectStatus.STANDBY, NOW)));

        assertFalse(first.isNoOp());
        assertTrue(second.isNoOp());
        verify(projectRepository, times(1)).updateStatus(any(), any(), any(), any());
        verify(changePublisher, times(1)).projectUpdated(any(), any());
    }

    @Test
    void lostRace_isRecordedAsConflictWithoutNotification() {
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(projectRepository.updateStatus(any(), any(), any(), any())).thenReturn(false);

        var result = service.reconcileProjects(List.of(project("P-1", ProjectStatus.ACTIVE)));

        assertEquals(List.of("P-1"), result.conflicts());
        assertTrue(result.transitions().isEmpty());
        verifyNoInteractions(changePublisher);
    }

    @Test
    void readFailure_abandonsOnlyThatProject() {
        when(phaseRepository.findPhases("P-1")).thenThrow(new DataAccessResourceFailureException("store unavailable"));
        when(phaseRepository.findPhases("P-2")).thenReturn(List.of(endedPhase("P-2")));
        when(projectRepository.updateStatus("P-2", "ACTIVE", ProjectStatus.STANDBY, NOW)).thenReturn(true);

        var result = service.reconcileProjects(List.of(
            project("P-1", ProjectStatus.ACTIVE), project("P-2", ProjectStatus.ACTIVE)));

        assertEquals(2, result.projectsChecked());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("P-1"));
        assertEquals("P-2", result.transitions().get(0).projectId());
        verify(projectRepository, never()).updateStatus(eq("P-1"), any(), any(), any());
    }

    @Test
    void delegationReadFailure_abandonsPassBeforeAnyWrite() {
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(tempApproverService.readDelegation(any(Project.class)))
            .thenReturn(Try.failure(new DataAccessResourceFailureException("store down")));

        var result = service.reconcileProjects(List.of(project("P-1", ProjectStatus.ACTIVE).withTempApprover("delegate-1")));

        assertEquals(List.of("P-1: store down"), result.errors());
        assertTrue(result.transitions().isEmpty());
        verify(projectRepository, never()).updateStatus(any(), any(), any(), any());
        verify(tempApproverService, never()).settle(any(), any());
        verifyNoInteractions(changePublisher);
    }

    @Test
    void delegationIsSettledFromTheSnapshotReadBeforeTheStatusWrite() {
        var pending = TempApprover.pending("P-1", "delegate-1", NOW.plusDays(1), NOW.plusDays(5), NOW);
        var delegated = project("P-1", ProjectStatus.ACTIVE).withTempApprover("delegate-1");
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(tempApproverService.readDelegation(delegated)).thenReturn(Try.success(Optional.of(pending)));
        when(projectRepository.updateStatus(any(), any(), any(), any())).thenReturn(true);

        service.reconcileProjects(List.of(delegated));

        var order = inOrder(tempApproverService, projectRepository);
        order.verify(tempApproverService).readDelegation(delegated);
        order.verify(projectRepository).updateStatus("P-1", "ACTIVE", ProjectStatus.STANDBY, NOW);
        order.verify(tempApproverService).settle(delegated, Optional.of(pending));
    }

    @Test
    void legacyStatusText_isCarriedIntoConditionalWrite() {
        var legacy = new Project("P-1", "Villa", "On Hold", Optional.of(TODAY.minusMonths(3)),
            Optional.empty(), Optional.empty(), Optional.empty(), true, Optional.of(TODAY.minusDays(14)),
            Optional.of("Permit"), Set.of(), List.of("manager-1"), Optional.empty(), Optional.empty(), Optional.empty());
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(runningPhase("P-1")));
        when(projectRepository.unsuspend("P-1", "On Hold", ProjectStatus.ACTIVE, NOW)).thenReturn(true);

        var result = service.reconcileProjects(List.of(legacy));

        assertEquals(ProjectStatus.LOCKED, result.transitions().get(0).from());
        assertTrue(result.conflicts().isEmpty());
        verify(projectRepository).unsuspend("P-1", "On Hold", ProjectStatus.ACTIVE, NOW);
    }

    @Test
    void expiredSuspension_isLiftedBeforeStatusPass() {
        var suspended = project("P-1", ProjectStatus.ACTIVE).suspendedUntil(TODAY.minusDays(1), "Permit");
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")));
        when(projectRepository.unsuspend("P-1", "SUSPENDED", ProjectStatus.ACTIVE, NOW)).thenReturn(true);

        var result = service.reconcileProjects(List.of(suspended));

        assertEquals(1, result.transitions().size());
        assertTrue(result.transitions().get(0).unsuspend());
        verify(projectRepository, never()).updateStatus(any(), any(), any(), any());
        verify(changePublisher).projectUpdated(eq("P-1"), anyString());
    }

    @Test
    void expiredDelegation_isReportedAndNotified() {
        var expired = TempApprover.pending("P-1", "delegate-1", NOW.minusDays(10), NOW.minusDays(1), NOW.minusDays(11))
            .withStatus(TempApproverStatus.EXPIRED, NOW);
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(runningPhase("P-1")));
        when(tempApproverService.settle(any(Project.class), any())).thenReturn(Optional.of(
            new TempApproverService.Observation(expired, TempApproverStatus.PENDING, true, true)));

        var result = service.reconcileProjects(List.of(project("P-1", ProjectStatus.ACTIVE).withTempApprover("delegate-1")));

        assertEquals(List.of("P-1/delegate-1"), result.expiredDelegations());
        verify(changePublisher).projectUpdated(eq("P-1"), contains("EXPIRED"));
    }

    @Test
    void reconcileProject_unknownProject_isEmpty() {
        when(projectRepository.findById("P-404")).thenReturn(Optional.empty());

        var result = service.reconcileProject("P-404");

        assertEquals(0, result.projectsChecked());
        verifyNoInteractions(phaseRepository);
    }

    @Test
    void reconcileAll_listFailure_isReportedNotThrown() {
        when(projectRepository.findAll()).thenThrow(new DataAccessResourceFailureException("store unavailable"));

        var result = service.reconcileAll();

        assertTrue(result.hasErrors());
    }

    // ========================================================================
    // Phase load
    // ========================================================================

    @Test
    void loadProjectBudget_aggregatesPhasesConcurrentlyAndFlagsDegraded() {
        var legacy = endedPhase("P-1").withLegacyBudgets(Map.of("Civil", new BigDecimal("3000")));
        var running = runningPhase("P-1");
        when(projectRepository.findById("P-1")).thenReturn(Optional.of(project("P-1", ProjectStatus.STANDBY)));
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(legacy, running));
        when(phaseRepository.findDepartments("P-1", "PH-1")).thenThrow(new DataAccessResourceFailureException("timeout"));
        when(phaseRepository.findDepartments("P-1", "PH-2")).thenReturn(List.of(
            Department.of("P-1", "PH-2", "Electrical", ContractorMode.TURNKEY,
                List.of(DepartmentLineItem.of("Wiring", new BigDecimal("2"), "lot", new BigDecimal("1000"))))));
        when(expenseRepository.findApproved("P-1")).thenReturn(List.of(
            Expense.approved("E-1", "P-1", "PH-1", "PH-1_Civil", new BigDecimal("500")),
            Expense.approved("E-2", "P-1", "PH-2", "PH-2_Electrical", new BigDecimal("700"))));
        when(projectRepository.updateStatus("P-1", "STANDBY", ProjectStatus.ACTIVE, NOW)).thenReturn(true);

        var budget = service.loadProjectBudget("P-1").get();

        assertTrue(budget.degraded());
        assertEquals(0, new BigDecimal("5000").compareTo(budget.totalBudget()));
        assertEquals(0, new BigDecimal("1200").compareTo(budget.approvedAmount()));
        assertTrue(budget.phase("PH-1").orElseThrow().degraded());
        assertFalse(budget.phase("PH-2").orElseThrow().degraded());
        assertEquals(List.of("PH-1", "PH-2"), budget.phases().stream().map(p -> p.phaseId()).toList());
        verify(projectRepository).updateStatus("P-1", "STANDBY", ProjectStatus.ACTIVE, NOW);
    }

    @Test
    void loadProjectBudget_statusPassFailure_stillReturnsFigures() {
        when(projectRepository.findById("P-1")).thenReturn(Optional.of(
            project("P-1", ProjectStatus.ACTIVE).withTempApprover("delegate-1")));
        when(phaseRepository.findPhases("P-1")).thenReturn(List.of(endedPhase("P-1")
            .withLegacyBudgets(Map.of("Civil", new BigDecimal("3000")))));
        when(phaseRepository.findDepartments("P-1", "PH-1")).thenReturn(List.of());
        when(expenseRepository.findApproved("P-1")).thenReturn(List.of());
        when(tempApproverService.readDelegation(any(Project.class)))
            .thenReturn(Try.failure(new DataAccessResourceFailureException("store down")));

        var result = service.loadProjectBudget("P-1");

        assertTrue(result.isSuccess());
        assertEquals(0, new BigDecimal("3000").compareTo(result.get().totalBudget()));
        verify(projectRepository, never()).updateStatus(any(), any(), any(), any());
    }

    @Test
    void loadProjectBudget_unknownProject_isFailure() {
        when(projectRepository.findById("P-404")).thenReturn(Optional.empty());

        var result = service.loadProjectBudget("P-404");

        assertTrue(result.isFailure());
        assertInstanceOf(java.util.NoSuchElementException.class, result.getCause());
    }
}
