package io.github.mvbazaar.jobs.retention;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.Period;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {
    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Test
    void dayPolicySubtractsWholeDays() {
        assertEquals(Instant.parse("2025-05-16T12:00:00Z"), RetentionPolicies.PENDING_INVITATIONS.cutoff(NOW));
        assertEquals(Instant.parse("2025-03-17T12:00:00Z"), RetentionPolicies.INACTIVE_PUSH_TOKENS.cutoff(NOW));
    }

    @Test
    void yearPolicyUsesCalendarArithmetic() {
        assertEquals(Instant.parse("2024-06-15T12:00:00Z"), RetentionPolicies.AUDIT_LOG_ANONYMIZATION.cutoff(NOW));
        assertEquals(Instant.parse("2022-06-15T12:00:00Z"), RetentionPolicies.AUDIT_LOG_DELETION.cutoff(NOW));
        // leap day clamps to Feb 28
        assertEquals(Instant.parse("2023-02-28T00:00:00Z"),
                RetentionPolicies.AUDIT_LOG_ANONYMIZATION.cutoff(Instant.parse("2024-02-29T00:00:00Z")));
    }

    @Test
    void eligibilityIsStrictlyBeforeCutoff() {
        RetentionPolicy policy = RetentionPolicies.PENDING_INVITATIONS;
        Instant cutoff = policy.cutoff(NOW);
        assertTrue(policy.isEligible(cutoff.minusSeconds(1), NOW));
        assertFalse(policy.isEligible(cutoff, NOW));
        assertFalse(policy.isEligible(cutoff.plusSeconds(1), NOW));
        assertFalse(policy.isEligible(null, NOW));
    }

    @Test
    void gracePeriodExpiry() {
        assertEquals(Instant.parse("2025-07-15T12:00:00Z"), RetentionPolicies.ACCOUNT_DELETION_GRACE.expiry(NOW));
    }

    @Test
    void retentionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy("none", Period.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicy.ofDays("negative", -1));
    }
}
