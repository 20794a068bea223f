package com.demo.policy.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Integrity tag over {@code submittedAt|policyVersion|fingerprint} plus a salt shared with the browser bundle.
 *
 * <p>The salt ships inside the client code, so anyone who reads the bundle can recompute a valid tag.
 * The tag detects corrupted or hand-edited consent data; it does not prove the submission came from our client.
 */
public class ConsentChecksum {

    private final String salt;
    private final int length;

    public ConsentChecksum(String salt, int length) {
        if (salt == null || salt.isEmpty()) {
            throw new IllegalArgumentException("checksum salt must not be empty");
        }
        this.salt = salt;
        this.length = length;
    }

    public static String canonical(long submittedAt, String policyVersion, String fingerprint) {
        return submittedAt + "|" + policyVersion + "|" + fingerprint;
    }

    public String compute(long submittedAt, String policyVersion, String fingerprint) {
        return HashUtil.sha256Prefix(canonical(submittedAt, policyVersion, fingerprint) + salt, length);
    }

    public boolean matches(long submittedAt, String policyVersion, String fingerprint, String candidate) {
        if (candidate == null) return false;
        byte[] expected = compute(submittedAt, policyVersion, fingerprint).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.UTF_8));
    }
}
