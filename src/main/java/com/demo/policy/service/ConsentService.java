package com.demo.policy.service;

import com.demo.policy.repository.ConsentRecord;
import com.demo.policy.service.dto.CheckResult;
import com.demo.policy.service.dto.ConsentStats;
import com.demo.policy.service.dto.PolicyInfo;
import com.demo.policy.service.dto.VerifyOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.Supplier;

/**
 * verify / check / revoke / sweep over the validator and the store.
 *
 * <p>Storage calls go through {@code storeRetry} (one retry with backoff). When that still fails the call ends in
 * {@link ConsentStoreUnavailableException}, except {@link #check} which answers "no consent" flagged as unavailable.
 * Other {@link DataAccessException}s (integrity violations, bad SQL) are not an outage and propagate unchanged.
 */
@Slf4j
@Service
public class ConsentService {

    private final ConsentValidator validator;
    private final ConsentStore store;
    private final ConsentPolicy policy;
    private final Clock clock;
    private final RetryTemplate storeRetry;

    public ConsentService(ConsentValidator validator, ConsentStore store, ConsentPolicy policy,
                          Clock clock, RetryTemplate storeRetry) {
        this.validator = validator;
        this.store = store;
        this.policy = policy;
        this.clock = clock;
        this.storeRetry = storeRetry;
    }

    public VerifyOutcome verify(ConsentSubmission submission, ClientMeta meta) {
        ClientMeta m = meta == null ? ClientMeta.NONE : meta;
        ValidationResult result = validator.validate(submission, clock.instant());
        if (!result.isAccepted()) {
            log.warn("Policy consent rejected: kind={}, fingerprint={}, ip={}, userAgent={}",
                    result.errorKind(), submission == null ? null : submission.fingerprint(),
                    m.ipAddress(), abbreviate(m.userAgent()));
            return VerifyOutcome.rejected(result.errorKind(), result.message());
        }

        ConsentSubmission accepted = result.submission();
        ConsentRecord saved = withStore("verify", () -> store.insert(accepted, m));
        log.info("Policy consent recorded: id={}, version={}, fingerprint={}, ip={}, expiresAt={}",
                saved.id(), saved.policyVersion(), saved.fingerprint(), m.ipAddress(), saved.expiresAt());
        return VerifyOutcome.accepted(saved.id(), saved.expiresAt());
    }

    public CheckResult check(String fingerprint, String policyVersion) {
        String fp = validator.requireFingerprint(fingerprint);
        String version = validator.requireVersion(policyVersion);
        try {
            Instant now = clock.instant();
            return withStore("check", () -> store.findLatestValid(fp, version))
                    .filter(r -> r.stateAt(now) == ConsentState.VALID)
                    .map(CheckResult::of)
                    .orElseGet(CheckResult::none);
        } catch (ConsentStoreUnavailableException e) {
            log.error("Consent check failed closed for fingerprint={}: {}", fp, e.getMessage());
            return CheckResult.unavailable();
        }
    }

    /**
     * @param policyVersion version to revoke, or {@code null} to revoke every version of the fingerprint
     */
    public int revoke(String fingerprint, String policyVersion) {
        String fp = validator.requireFingerprint(fingerprint);
        String version = policyVersion == null ? null : validator.requireVersion(policyVersion);
        int count = withStore("revoke", () -> version == null
                ? store.invalidateAll(fp)
                : store.invalidateAll(fp, version));
        log.info("Policy consent revoked: fingerprint={}, version={}, revokedCount={}", fp, version, count);
        return count;
    }

    public int sweep() {
        int deleted = withStore("sweep", store::sweepExpired);
        log.info("Expired policy consents cleaned: deletedCount={}", deleted);
        return deleted;
    }

    /**
     * @param startDate first UTC day of the detailed breakdown, or {@code null} for no lower bound
     * @param endDate   last UTC day (inclusive) of the detailed breakdown, or {@code null} for no upper bound
     */
    public ConsentStats stats(int trendDays, LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidRequestException("INVALID_DATE_RANGE", "startDate must not be after endDate");
        }
        Instant from = startDate == null ? null : startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant until = endDate == null ? null : endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant now = clock.instant();
        Map<ConsentState, Long> byState = withStore("stats", store::countByState);
        Map<String, Long> versions = withStore("stats", store::countValidByVersion);
        var trend = withStore("stats", () -> store.dailyAcceptances(now.minus(Duration.ofDays(trendDays))));
        var detailed = withStore("stats", () -> store.dailyBreakdown(from, until));
        return new ConsentStats(
                now,
                policy.activeVersion(),
                byState.getOrDefault(ConsentState.VALID, 0L),
                byState.getOrDefault(ConsentState.EXPIRED, 0L),
                byState.getOrDefault(ConsentState.REVOKED, 0L),
                versions,
                trend,
                detailed
        );
    }

    public PolicyInfo policyInfo() {
        return new PolicyInfo(policy.activeVersion(), policy.validityDays(), policy.freshnessWindow().toSeconds());
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return storeRetry.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying consent store {} after: {}", operation, String.valueOf(ctx.getLastThrowable()));
                }
                return action.get();
            });
        } catch (DataAccessException e) {
            if (isOutage(e)) {
                throw new ConsentStoreUnavailableException(operation, e);
            }
            throw e;
        }
    }

    // same classification the retry template retries on, causes included
    private static boolean isOutage(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof DataAccessResourceFailureException) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String s) {
        return s == null || s.length() <= 100 ? s : s.substring(0, 100);
    }
}
