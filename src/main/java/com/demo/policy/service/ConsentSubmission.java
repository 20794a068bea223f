package com.demo.policy.service;

/**
 * Consent proof as sent by the client. Fields are nullable here; {@link ConsentValidator} decides.
 */
public record ConsentSubmission(Long submittedAt, String policyVersion, String fingerprint, String checksum) {
}
