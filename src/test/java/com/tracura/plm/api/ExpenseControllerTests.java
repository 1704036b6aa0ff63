package com.tracura.plm.api;

import com.tracura.plm.domain.ExpenseStatus;
import com.tracura.plm.domain.ExpenseSubmission;
import com.tracura.plm.domain.ValidationResult;
import com.tracura.plm.service.ExpenseService;
import io.vavr.control.Either;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExpenseController.class)
class ExpenseControllerTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExpenseService expenseService;

    @Test
    void submit_usesPathProjectAndHeaderUser() throws Exception {
        when(expenseService.submit(any())).thenReturn(
            Either.left(ValidationResult.error("PHASE_DISABLED", "Phase is disabled", "phaseId")));

        mockMvc.perform(post("/api/v1/projects/P-1/expenses")
                .header("X-User-Id", "member-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"projectId":"other","phaseId":"PH-1","department":"Civil","date":"2024-06-15","amount":100}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("PHASE_DISABLED"));

        verify(expenseService).submit(argThat((ExpenseSubmission s) ->
            s.projectId().equals("P-1") && s.submittedBy().equals("member-1")));
    }

    @Test
    void decide_unknownStatus_isBadRequest() throws Exception {
        mockMvc.perform(patch("/api/v1/projects/P-1/expenses/E-1/status")
                .header("X-User-Id", "manager-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"maybe\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(expenseService);
    }

    @Test
    void decide_errorCodesMapToHttpStatus() throws Exception {
        when(expenseService.decide(eq("P-1"), eq("E-1"), eq("member-1"), eq(ExpenseStatus.APPROVED), any()))
            .thenReturn(Either.left(ValidationResult.error("NOT_AUTHORIZED", "User cannot approve")));
        when(expenseService.decide(eq("P-1"), eq("E-2"), eq("manager-1"), eq(ExpenseStatus.REJECTED), any()))
            .thenReturn(Either.left(ValidationResult.error("CONFLICT", "Expense was decided concurrently")));

        mockMvc.perform(patch("/api/v1/projects/P-1/expenses/E-1/status")
                .header("X-User-Id", "member-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"approved\"}"))
            .andExpect(status().isForbidden());

        mockMvc.perform(patch("/api/v1/projects/P-1/expenses/E-2/status")
                .header("X-User-Id", "manager-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"REJECTED\",\"remark\":\"dup\"}"))
            .andExpect(status().isConflict());
    }
}
