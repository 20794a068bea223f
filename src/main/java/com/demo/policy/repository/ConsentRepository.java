package com.demo.policy.repository;

import com.demo.policy.service.ClientMeta;
import com.demo.policy.service.ConsentPolicy;
import com.demo.policy.service.ConsentState;
import com.demo.policy.service.ConsentStore;
import com.demo.policy.service.ConsentSubmission;
import com.demo.policy.service.dto.DailyCount;
import com.demo.policy.service.dto.VersionDailyStats;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC store over {@code core.PolicyConsents}. Timestamps are kept as UTC wall-clock values.
 * Lookups rely on the (fingerprint, policy_version, recorded_at) index, the sweep on the expires_at index.
 */
@Repository
@RequiredArgsConstructor
public class ConsentRepository implements ConsentStore {

    private static final String INSERT_COLUMNS =
            "id, submitted_at, policy_version, fingerprint, checksum, user_agent, ip_address, " +
            "recorded_at, expires_at, is_valid";
    private static final String COLUMNS = INSERT_COLUMNS + ", revoked_at";

    private final JdbcTemplate jdbc;
    private final Clock clock;
    private final ConsentPolicy policy;

    @Override
    public ConsentRecord insert(ConsentSubmission submission, ClientMeta clientMeta) {
        ClientMeta meta = clientMeta == null ? ClientMeta.NONE : clientMeta.truncated(policy.maxUserAgentLength());
        Instant recordedAt = now();
        ConsentRecord record = new ConsentRecord(
                UUID.randomUUID().toString(),
                submission.submittedAt(),
                submission.policyVersion(),
                submission.fingerprint(),
                submission.checksum(),
                meta.userAgent(),
                meta.ipAddress(),
                recordedAt,
                recordedAt.plus(policy.validityPeriod()),
                true,
                null
        );

        jdbc.update("INSERT INTO core.PolicyConsents (" + INSERT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.id(),
                record.submittedAt(),
                record.policyVersion(),
                record.fingerprint(),
                record.checksum(),
                record.userAgent(),
                record.ipAddress(),
                toDb(record.recordedAt()),
                toDb(record.expiresAt()),
                true);
        return record;
    }

    @Override
    public Optional<ConsentRecord> findLatestValid(String fingerprint, String policyVersion) {
        String sql = """
            SELECT %s
            FROM core.PolicyConsents
            WHERE fingerprint = ? AND policy_version = ? AND is_valid = ? AND expires_at > ?
            ORDER BY recorded_at DESC
            OFFSET 0 ROWS FETCH NEXT 1 ROWS ONLY
        """.formatted(COLUMNS);
        return jdbc.query(sql, rm(), fingerprint, policyVersion, true, toDb(now())).stream().findFirst();
    }

    @Override
    public int invalidateAll(String fingerprint, String policyVersion) {
        return jdbc.update("""
            UPDATE core.PolicyConsents SET is_valid = ?, revoked_at = ?
            WHERE fingerprint = ? AND policy_version = ? AND is_valid = ?
        """, false, toDb(now()), fingerprint, policyVersion, true);
    }

    @Override
    public int invalidateAll(String fingerprint) {
        return jdbc.update("""
            UPDATE core.PolicyConsents SET is_valid = ?, revoked_at = ?
            WHERE fingerprint = ? AND is_valid = ?
        """, false, toDb(now()), fingerprint, true);
    }

    @Override
    public int sweepExpired() {
        return jdbc.update("DELETE FROM core.PolicyConsents WHERE expires_at <= ? OR is_valid = ?",
                toDb(now()), false);
    }

    @Override
    public Map<ConsentState, Long> countByState() {
        Timestamp now = toDb(now());
        Map<ConsentState, Long> out = new EnumMap<>(ConsentState.class);
        out.put(ConsentState.VALID, count("is_valid = ? AND expires_at > ?", true, now));
        out.put(ConsentState.EXPIRED, count("is_valid = ? AND expires_at <= ?", true, now));
        out.put(ConsentState.REVOKED, count("is_valid = ?", false));
        return out;
    }

    @Override
    public Map<String, Long> countValidByVersion() {
        String sql = """
            SELECT policy_version, COUNT(*) AS cnt
            FROM core.PolicyConsents
            WHERE is_valid = ? AND expires_at > ?
            GROUP BY policy_version
            ORDER BY policy_version
        """;
        Map<String, Long> out = new LinkedHashMap<>();
        jdbc.query(sql, rs -> {
            out.put(rs.getString("policy_version"), rs.getLong("cnt"));
        }, true, toDb(now()));
        return out;
    }

    @Override
    public List<DailyCount> dailyAcceptances(Instant since) {
        String sql = """
            SELECT CAST(recorded_at AS DATE) AS accepted_on, COUNT(*) AS cnt
            FROM core.PolicyConsents
            WHERE recorded_at >= ?
            GROUP BY CAST(recorded_at AS DATE)
            ORDER BY accepted_on
        """;
        return jdbc.query(sql, (rs, i) -> new DailyCount(rs.getDate("accepted_on").toLocalDate(), rs.getLong("cnt")),
                toDb(since));
    }

    @Override
    public List<VersionDailyStats> dailyBreakdown(Instant from, Instant until) {
        List<String> where = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (from != null) {
            where.add("recorded_at >= ?");
            args.add(toDb(from));
        }
        if (until != null) {
            where.add("recorded_at < ?");
            args.add(toDb(until));
        }
        String sql = """
            SELECT policy_version, CAST(recorded_at AS DATE) AS accepted_on, COUNT(*) AS cnt,
                   COUNT(DISTINCT fingerprint) AS fingerprints, COUNT(DISTINCT ip_address) AS ips
            FROM core.PolicyConsents
            %s
            GROUP BY policy_version, CAST(recorded_at AS DATE)
            ORDER BY accepted_on DESC, policy_version
        """.formatted(where.isEmpty() ? "" : "WHERE " + String.join(" AND ", where));
        return jdbc.query(sql, (rs, i) -> new VersionDailyStats(
                rs.getString("policy_version"),
                rs.getDate("accepted_on").toLocalDate(),
                rs.getLong("cnt"),
                rs.getLong("fingerprints"),
                rs.getLong("ips")
        ), args.toArray());
    }

    private long count(String where, Object... args) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM core.PolicyConsents WHERE " + where, Long.class, args);
        return n == null ? 0L : n;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private RowMapper<ConsentRecord> rm() {
        return (rs, i) -> new ConsentRecord(
                rs.getString("id"),
                rs.getLong("submitted_at"),
                rs.getString("policy_version"),
                rs.getString("fingerprint"),
                rs.getString("checksum"),
                rs.getString("user_agent"),
                rs.getString("ip_address"),
                fromDb(rs.getTimestamp("recorded_at")),
                fromDb(rs.getTimestamp("expires_at")),
                rs.getBoolean("is_valid"),
                fromDb(rs.getTimestamp("revoked_at"))
        );
    }

    private static Timestamp toDb(Instant instant) {
        return instant == null ? null : Timestamp.valueOf(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    private static Instant fromDb(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime().toInstant(ZoneOffset.UTC);
    }
}
