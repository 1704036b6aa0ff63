package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Candidate expense as entered by a team member. {@code department} is the plain department name.
 */
public record ExpenseSubmission(
    String projectId,
    String phaseId,
    String department,
    LocalDate date,
    BigDecimal amount,
    String submittedBy
) {
    public ExpenseSubmission withProject(String newProjectId, String user) {
        return new ExpenseSubmission(newProjectId, phaseId, department, date, amount, user);
    }
}
