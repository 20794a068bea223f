package com.demo.policy.service.dto;

import com.demo.policy.service.ConsentErrorKind;

import java.time.Instant;

public record VerifyOutcome(boolean accepted, String id, Instant expiresAt, ConsentErrorKind errorKind, String message) {

    public static VerifyOutcome accepted(String id, Instant expiresAt) {
        return new VerifyOutcome(true, id, expiresAt, null, null);
    }

    public static VerifyOutcome rejected(ConsentErrorKind kind, String message) {
        return new VerifyOutcome(false, null, null, kind, message);
    }
}
