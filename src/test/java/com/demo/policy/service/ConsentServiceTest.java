package com.demo.policy.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;

import com.demo.policy.MutableClock;
import com.demo.policy.TestPolicies;
import com.demo.policy.config.ConsentConfig;
import com.demo.policy.repository.ConsentRecord;
import com.demo.policy.service.dto.CheckResult;
import com.demo.policy.service.dto.ConsentStats;
import com.demo.policy.service.dto.DailyCount;
import com.demo.policy.service.dto.VersionDailyStats;
import com.demo.policy.service.dto.VerifyOutcome;

@ExtendWith(MockitoExtension.class)
class ConsentServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-18T08:00:00Z");

    @Mock
    private ConsentStore store;

    private MutableClock clock;
    private ConsentChecksum checksum;
    private ConsentService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        checksum = TestPolicies.checksum();
        ConsentPolicy policy = TestPolicies.defaults();
        RetryTemplate retry = new ConsentConfig().consentStoreRetry(Duration.ofMillis(1));
        service = new ConsentService(new ConsentValidator(policy, checksum), store, policy, clock, retry);
    }

    private ConsentSubmission signed(long ts, String fp) {
        return new ConsentSubmission(ts, "2.0", fp, checksum.compute(ts, "2.0", fp));
    }

    private static ConsentRecord record(String id, String fp, Instant recordedAt, boolean valid) {
        return new ConsentRecord(id, recordedAt.toEpochMilli(), "2.0", fp, "tag", null, null,
                recordedAt, recordedAt.plus(Duration.ofDays(30)), valid, null);
    }

    @Test
    void verify_validSubmission_insertsAndReturnsIdAndExpiry() {
        ConsentRecord saved = record("id-1", "abc", NOW, true);
        when(store.insert(any(ConsentSubmission.class), any(ClientMeta.class))).thenReturn(saved);

        VerifyOutcome out = service.verify(signed(NOW.toEpochMilli(), "abc"), new ClientMeta("UA", "10.0.0.1"));

        assertTrue(out.accepted());
        assertEquals("id-1", out.id());
        assertEquals(NOW.plus(Duration.ofDays(30)), out.expiresAt());
        ArgumentCaptor<ClientMeta> meta = ArgumentCaptor.forClass(ClientMeta.class);
        verify(store).insert(any(ConsentSubmission.class), meta.capture());
        assertEquals("10.0.0.1", meta.getValue().ipAddress());
    }

    @Test
    void verify_rejectedSubmission_neverTouchesStore() {
        VerifyOutcome out = service.verify(signed(NOW.toEpochMilli() - 60_000L, "abc"), null);

        assertFalse(out.accepted());
        assertEquals(ConsentErrorKind.TIMESTAMP_OUT_OF_WINDOW, out.errorKind());
        assertNull(out.id());
        verifyNoInteractions(store);
    }

    @Test
    void verify_transientStoreFailure_isRetriedOnce() {
        ConsentRecord saved = record("id-2", "abc", NOW, true);
        when(store.insert(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenReturn(saved);

        VerifyOutcome out = service.verify(signed(NOW.toEpochMilli(), "abc"), ClientMeta.NONE);

        assertTrue(out.accepted());
        verify(store, times(2)).insert(any(), any());
    }

    @Test
    void verify_storeDownAfterRetry_surfacesUnavailable() {
        when(store.insert(any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThrows(ConsentStoreUnavailableException.class,
                () -> service.verify(signed(NOW.toEpochMilli(), "abc"), ClientMeta.NONE));
        verify(store, times(2)).insert(any(), any());
    }

    @Test
    void verify_nonTransientStoreFailure_isNotRetriedNorReportedAsOutage() {
        when(store.insert(any(), any())).thenThrow(new DataIntegrityViolationException("value too long"));

        assertThrows(DataIntegrityViolationException.class,
                () -> service.verify(signed(NOW.toEpochMilli(), "abc"), ClientMeta.NONE));
        verify(store, times(1)).insert(any(), any());
    }

    @Test
    void check_validRecord_reportsConsent() {
        when(store.findLatestValid("abc", "2.0")).thenReturn(Optional.of(record("id-3", "abc", NOW, true)));

        CheckResult r = service.check(" abc ", "2.0");

        assertTrue(r.hasValidConsent());
        assertTrue(r.storeAvailable());
        assertEquals("id-3", r.id());
    }

    @Test
    void check_recordPastExpiry_isNotConsent() {
        when(store.findLatestValid("abc", "2.0"))
                .thenReturn(Optional.of(record("id-4", "abc", NOW.minus(Duration.ofDays(31)), true)));

        assertFalse(service.check("abc", "2.0").hasValidConsent());
    }

    @Test
    void check_storeOutage_failsClosed() {
        when(store.findLatestValid("abc", "2.0")).thenThrow(new DataAccessResourceFailureException("down"));

        CheckResult r = service.check("abc", "2.0");

        assertFalse(r.hasValidConsent());
        assertFalse(r.storeAvailable());
        verify(store, times(2)).findLatestValid("abc", "2.0");
    }

    @Test
    void check_isRepeatable() {
        when(store.findLatestValid("abc", "2.0")).thenReturn(Optional.of(record("id-5", "abc", NOW, true)));

        assertEquals(service.check("abc", "2.0"), service.check("abc", "2.0"));
    }

    @Test
    void check_missingFingerprint_isInvalidRequest() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class, () -> service.check(null, "2.0"));
        assertEquals("MISSING_FINGERPRINT", ex.getCode());
        verifyNoInteractions(store);
    }

    @Test
    void revoke_withVersion_targetsThatVersion() {
        when(store.invalidateAll("abc", "2.0")).thenReturn(2);

        assertEquals(2, service.revoke("abc", "2.0"));
        verify(store, never()).invalidateAll("abc");
    }

    @Test
    void revoke_withoutVersion_targetsEveryVersion() {
        when(store.invalidateAll("abc")).thenReturn(3);

        assertEquals(3, service.revoke("abc", null));
    }

    @Test
    void sweep_returnsDeletedCount() {
        when(store.sweepExpired()).thenReturn(7);

        assertEquals(7, service.sweep());
    }

    @Test
    void stats_combinesStoreCounts() {
        Map<ConsentState, Long> byState = new EnumMap<>(ConsentState.class);
        byState.put(ConsentState.VALID, 4L);
        byState.put(ConsentState.REVOKED, 1L);
        when(store.countByState()).thenReturn(byState);
        when(store.countValidByVersion()).thenReturn(Map.of("2.0", 4L));
        when(store.dailyAcceptances(NOW.minus(Duration.ofDays(7))))
                .thenReturn(List.of(new DailyCount(NOW.atZone(clock.getZone()).toLocalDate(), 4L)));

        ConsentStats stats = service.stats(7, null, null);

        assertEquals(4L, stats.validConsents());
        assertEquals(0L, stats.expiredConsents());
        assertEquals(1L, stats.revokedConsents());
        assertEquals("2.0", stats.currentVersion());
        assertEquals(1, stats.recentTrend().size());
        verify(store).dailyBreakdown(null, null);
    }

    @Test
    void stats_dateRange_coversWholeUtcDays() {
        LocalDate start = LocalDate.of(2026, 10, 1);
        LocalDate end = LocalDate.of(2026, 10, 17);
        VersionDailyStats row = new VersionDailyStats("2.0", end, 3L, 2L, 1L);
        when(store.dailyBreakdown(Instant.parse("2026-10-01T00:00:00Z"), Instant.parse("2026-10-18T00:00:00Z")))
                .thenReturn(List.of(row));

        ConsentStats stats = service.stats(7, start, end);

        assertEquals(List.of(row), stats.detailed());
    }

    @Test
    void stats_startAfterEnd_isInvalidRange() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> service.stats(7, LocalDate.of(2026, 10, 2), LocalDate.of(2026, 10, 1)));

        assertEquals("INVALID_DATE_RANGE", ex.getCode());
        verifyNoInteractions(store);
    }

    @Test
    void policyInfo_exposesConfiguredValues() {
        var info = service.policyInfo();
        assertEquals("2.0", info.version());
        assertEquals(30L, info.validityDays());
        assertEquals(20L, info.freshnessWindowSeconds());
    }
}
