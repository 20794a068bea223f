package com.demo.policy.service;

/**
 * Heuristic device identifier, same derivation as the browser client.
 * Collisions between devices are expected; a fingerprint is never treated as a credential.
 */
public class FingerprintGenerator {

    static final String DELIMITER = "|";

    private final int length;

    public FingerprintGenerator(int length) {
        this.length = length;
    }

    public String generate(EnvironmentSignals signals) {
        return HashUtil.sha256Prefix(String.join(DELIMITER, signals.ordered()), length);
    }
}
