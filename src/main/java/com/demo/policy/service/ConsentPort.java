package com.demo.policy.service;

/**
 * Consent operations as seen from a caller of the policy API.
 */
public interface ConsentPort {
    boolean hasConsent(String fingerprint, String policyVersion);
    String  grantConsent(EnvironmentSignals signals);
    int     revokeConsent(String fingerprint, String policyVersion);
}
