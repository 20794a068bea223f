package com.demo.policy.service.dto;

import com.demo.policy.repository.ConsentRecord;

import java.time.Instant;

/**
 * Answer to "is consent on file". {@code storeAvailable=false} always comes with {@code hasValidConsent=false}.
 */
public record CheckResult(boolean hasValidConsent, boolean storeAvailable, String id, String policyVersion,
                          Instant recordedAt, Instant expiresAt) {

    public static CheckResult of(ConsentRecord r) {
        return new CheckResult(true, true, r.id(), r.policyVersion(), r.recordedAt(), r.expiresAt());
    }

    public static CheckResult none() {
        return new CheckResult(false, true, null, null, null, null);
    }

    public static CheckResult unavailable() {
        return new CheckResult(false, false, null, null, null, null);
    }
}
