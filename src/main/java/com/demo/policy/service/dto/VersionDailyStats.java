package com.demo.policy.service.dto;

import java.time.LocalDate;

/** Acceptances of one policy version on one UTC day. */
public record VersionDailyStats(
        String policyVersion,
        LocalDate day,
        long count,
        long uniqueFingerprints,
        long uniqueIps
) {}
