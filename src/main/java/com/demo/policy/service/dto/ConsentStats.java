package com.demo.policy.service.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ConsentStats(
        Instant generatedAt,
        String currentVersion,
        long validConsents,
        long expiredConsents,
        long revokedConsents,
        Map<String, Long> versions,
        List<DailyCount> recentTrend,
        List<VersionDailyStats> detailed
) {}
