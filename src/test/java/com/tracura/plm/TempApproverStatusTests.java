package com.tracura.plm;

import com.tracura.plm.domain.TempApproverStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the temporary approver status function.
 */
class TempApproverStatusTests {

    private static final LocalDateTime START = LocalDateTime.of(2024, 6, 10, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 6, 20, 23, 59);

    @ParameterizedTest
    @CsvSource({
        // stored, now, expected
        "PENDING,  2024-06-01T09:00, PENDING",
        "PENDING,  2024-06-15T09:00, PENDING",
        "PENDING,  2024-06-21T00:00, EXPIRED",
        "ACCEPTED, 2024-06-01T09:00, ACCEPTED",
        "ACCEPTED, 2024-06-10T00:00, ACTIVE",
        "ACCEPTED, 2024-06-20T23:59, ACTIVE",
        "ACCEPTED, 2024-06-21T00:00, EXPIRED",
        "ACTIVE,   2024-06-15T09:00, ACTIVE",
        "ACTIVE,   2024-06-21T00:00, EXPIRED",
        "EXPIRED,  2024-06-15T09:00, EXPIRED",
        "REJECTED, 2024-06-15T09:00, REJECTED"
    })
    void currentStatus_shouldFollowWindow(String stored, String now, String expected) {
        var status = TempApproverStatus.currentStatus(
            TempApproverStatus.valueOf(stored), START, END, LocalDateTime.parse(now));

        assertEquals(TempApproverStatus.valueOf(expected), status);
    }

    @Test
    void rejected_staysRejectedForEveryNow() {
        var now = START.minusYears(1);
        while (now.isBefore(END.plusYears(1))) {
            assertEquals(TempApproverStatus.REJECTED,
                TempApproverStatus.currentStatus(TempApproverStatus.REJECTED, START, END, now));
            now = now.plusDays(7);
        }
    }

    @Test
    void grantsAuthority_onlyWhenAcceptedOrActive() {
        assertTrue(TempApproverStatus.ACCEPTED.grantsAuthority());
        assertTrue(TempApproverStatus.ACTIVE.grantsAuthority());

        assertFalse(TempApproverStatus.PENDING.grantsAuthority());
        assertFalse(TempApproverStatus.REJECTED.grantsAuthority());
        assertFalse(TempApproverStatus.EXPIRED.grantsAuthority());
    }

    @Test
    void fromStored_shouldIgnoreCaseAndRejectUnknown() {
        assertEquals(TempApproverStatus.ACTIVE, TempApproverStatus.fromStored(" active ").orElseThrow());
        assertTrue(TempApproverStatus.fromStored("REVOKED").isEmpty());
        assertTrue(TempApproverStatus.fromStored(null).isEmpty());
    }
}
