package com.demo.policy.service;

import com.demo.policy.repository.ConsentRecord;
import com.demo.policy.service.dto.DailyCount;
import com.demo.policy.service.dto.VersionDailyStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence port for consent records. Records are insert-only; revocation is the single mutation.
 */
public interface ConsentStore {

    /** Persists an already validated submission. The store assigns {@code id}, {@code recordedAt} and {@code expiresAt}. */
    ConsentRecord insert(ConsentSubmission submission, ClientMeta clientMeta);

    /** Most recently recorded record that is still valid and unexpired, if any. */
    Optional<ConsentRecord> findLatestValid(String fingerprint, String policyVersion);

    /** Revokes every still-valid record for the pair. Returns the number of rows flipped. */
    int invalidateAll(String fingerprint, String policyVersion);

    /** Revokes every still-valid record of the fingerprint, whatever the version. */
    int invalidateAll(String fingerprint);

    /** Deletes expired and revoked records. */
    int sweepExpired();

    Map<ConsentState, Long> countByState();

    Map<String, Long> countValidByVersion();

    List<DailyCount> dailyAcceptances(Instant since);

    /**
     * Per-version, per-day acceptance counts with distinct fingerprints and IPs, newest day first.
     * Either bound may be {@code null}; {@code from} is inclusive, {@code until} exclusive.
     */
    List<VersionDailyStats> dailyBreakdown(Instant from, Instant until);
}
