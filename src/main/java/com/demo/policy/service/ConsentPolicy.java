package com.demo.policy.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable consent settings, assembled once from configuration and handed to each collaborator.
 */
public record ConsentPolicy(
        String activeVersion,
        Duration freshnessWindow,
        Duration validityPeriod,
        String checksumSalt,
        int checksumLength,
        int maxFingerprintLength,
        int maxVersionLength,
        int maxChecksumLength,
        int maxUserAgentLength
) {

    public ConsentPolicy {
        Objects.requireNonNull(activeVersion, "activeVersion");
        Objects.requireNonNull(freshnessWindow, "freshnessWindow");
        Objects.requireNonNull(validityPeriod, "validityPeriod");
        if (activeVersion.isBlank()) {
            throw new IllegalArgumentException("activeVersion must not be blank");
        }
        if (freshnessWindow.isNegative() || validityPeriod.isNegative() || validityPeriod.isZero()) {
            throw new IllegalArgumentException("freshness window must be >= 0 and validity period > 0");
        }
    }

    public long validityDays() {
        return validityPeriod.toDays();
    }
}
