package com.demo.policy.service;

/**
 * Lifecycle of a stored consent. EXPIRED and REVOKED are both terminal and mean "no consent on file";
 * they are kept apart only for statistics.
 */
public enum ConsentState {
    VALID,
    EXPIRED,
    REVOKED
}
