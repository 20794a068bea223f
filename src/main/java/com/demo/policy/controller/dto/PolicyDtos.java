package com.demo.policy.controller.dto;

import com.demo.policy.service.ConsentErrorKind;
import com.demo.policy.service.ConsentSubmission;
import com.demo.policy.service.dto.CheckResult;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

public final class PolicyDtos {
    private PolicyDtos() {}

    // -------- Requests ----------
    /**
     * Flat body {@code {submittedAt, policyVersion, fingerprint, checksum}}. The older browser client sends
     * {@code {consent:{timestamp, version, fingerprint, checksum}, userAgent, timestamp}} instead; both are accepted.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VerifyRequest {
        @JsonAlias("timestamp")
        public Long   submittedAt;
        @JsonAlias("version")
        public String policyVersion;
        public String fingerprint;
        public String checksum;
        public String userAgent;      // optional, audit only
        public ConsentPayload consent; // nested legacy shape

        public ConsentSubmission toSubmission() {
            if (consent != null) {
                return new ConsentSubmission(consent.submittedAt, consent.policyVersion, consent.fingerprint, consent.checksum);
            }
            return new ConsentSubmission(submittedAt, policyVersion, fingerprint, checksum);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConsentPayload {
        @JsonAlias("timestamp")
        public Long   submittedAt;
        @JsonAlias("version")
        public String policyVersion;
        public String fingerprint;
        public String checksum;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RevokeRequest {
        public String fingerprint;
        @JsonAlias("version")
        public String policyVersion; // null revokes every version
    }

    // -------- Responses ----------
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class VerifyResponse {
        public boolean accepted;
        public String  id;
        public Instant expiresAt;
        public ConsentErrorKind errorKind;
        public String  message;
        public String  currentVersion; // only on VERSION_MISMATCH

        public static VerifyResponse accepted(String id, Instant expiresAt) {
            VerifyResponse r = new VerifyResponse();
            r.accepted = true;
            r.id = id;
            r.expiresAt = expiresAt;
            return r;
        }

        public static VerifyResponse rejected(ConsentErrorKind kind, String message) {
            VerifyResponse r = new VerifyResponse();
            r.errorKind = kind;
            r.message = message;
            return r;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CheckResponse {
        public boolean hasValidConsent;
        public String  id;
        public String  policyVersion;
        public Instant recordedAt;
        public Instant expiresAt;
        public String  currentVersion;
        public String  error; // "SERVICE_UNAVAILABLE" when the store could not be read

        public static CheckResponse from(CheckResult r, String currentVersion) {
            CheckResponse out = new CheckResponse();
            out.hasValidConsent = r.hasValidConsent();
            out.id = r.id();
            out.policyVersion = r.policyVersion();
            out.recordedAt = r.recordedAt();
            out.expiresAt = r.expiresAt();
            out.currentVersion = currentVersion;
            out.error = r.storeAvailable() ? null : "SERVICE_UNAVAILABLE";
            return out;
        }
    }

    public record RevokeResponse(int revokedCount) {}

    public record CleanupResponse(int deletedCount) {}
}
