package com.demo.policy.repository;

import com.demo.policy.service.ConsentState;

import java.time.Instant;

/**
 * One row of {@code core.PolicyConsents}. {@code expiresAt} is always {@code recordedAt + validityPeriod}.
 */
public record ConsentRecord(
        String id,
        long submittedAt,
        String policyVersion,
        String fingerprint,
        String checksum,
        String userAgent,
        String ipAddress,
        Instant recordedAt,
        Instant expiresAt,
        boolean valid,
        Instant revokedAt
) {

    public ConsentState stateAt(Instant now) {
        if (!valid) return ConsentState.REVOKED;
        if (!now.isBefore(expiresAt)) return ConsentState.EXPIRED;
        return ConsentState.VALID;
    }
}
