package com.demo.policy.service;

import java.time.Instant;

/**
 * Acceptance pipeline for a consent submission: structure, freshness, checksum, version.
 * Stages run in that fixed order and the first failure wins, so the same input always yields the same kind.
 */
public class ConsentValidator {

    private final ConsentPolicy policy;
    private final ConsentChecksum checksum;

    public ConsentValidator(ConsentPolicy policy, ConsentChecksum checksum) {
        this.policy = policy;
        this.checksum = checksum;
    }

    public ValidationResult validate(ConsentSubmission submission, Instant now) {
        // 1) Structure
        if (submission == null) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Missing consent payload");
        }
        String fingerprint = present(submission.fingerprint());
        String version = present(submission.policyVersion());
        String tag = present(submission.checksum());
        Long submittedAt = submission.submittedAt();

        if (submittedAt == null || fingerprint == null || version == null || tag == null) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Missing required consent fields");
        }
        // signed values are stored as sent, so they must match the checksum as sent
        if (padded(fingerprint) || padded(version) || padded(tag)) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID,
                    "Consent fields must not carry leading or trailing whitespace");
        }
        if (submittedAt <= 0) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "submittedAt must be a positive epoch millisecond value");
        }
        if (fingerprint.length() > policy.maxFingerprintLength()) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Invalid fingerprint format");
        }
        if (version.length() > policy.maxVersionLength()) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Invalid version format");
        }
        if (tag.length() > policy.maxChecksumLength()) {
            return ValidationResult.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Invalid checksum format");
        }

        // 2) Freshness, both directions
        long skew = Math.abs(now.toEpochMilli() - submittedAt);
        if (skew > policy.freshnessWindow().toMillis()) {
            return ValidationResult.rejected(ConsentErrorKind.TIMESTAMP_OUT_OF_WINDOW,
                    "Timestamp must be within " + policy.freshnessWindow().toSeconds() + " seconds of server time");
        }

        // 3) Integrity
        if (!checksum.matches(submittedAt, version, fingerprint, tag)) {
            return ValidationResult.rejected(ConsentErrorKind.CHECKSUM_MISMATCH, "Checksum verification failed");
        }

        // 4) Semantic
        if (!policy.activeVersion().equals(version)) {
            return ValidationResult.rejected(ConsentErrorKind.VERSION_MISMATCH, "Unsupported policy version");
        }

        return ValidationResult.accepted(new ConsentSubmission(submittedAt, version, fingerprint, tag));
    }

    /** Normalizes a fingerprint used as a lookup key. */
    public String requireFingerprint(String raw) {
        String v = trimmed(raw);
        if (raw == null) {
            throw new InvalidRequestException("MISSING_FINGERPRINT", "Missing or invalid fingerprint");
        }
        if (v == null || v.length() > policy.maxFingerprintLength()) {
            throw new InvalidRequestException("INVALID_FINGERPRINT", "Invalid fingerprint format");
        }
        return v;
    }

    /** Normalizes a policy version used as a lookup key. */
    public String requireVersion(String raw) {
        String v = trimmed(raw);
        if (raw == null) {
            throw new InvalidRequestException("MISSING_VERSION", "Missing or invalid version");
        }
        if (v == null || v.length() > policy.maxVersionLength()) {
            throw new InvalidRequestException("INVALID_VERSION", "Invalid version format");
        }
        return v;
    }

    // null for absent or blank values, otherwise unchanged
    private static String present(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static boolean padded(String s) {
        return !s.equals(s.trim());
    }

    // null for absent or blank values
    private static String trimmed(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
