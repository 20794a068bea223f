package com.demo.policy.client;

import com.demo.policy.service.ConsentErrorKind;

public class ConsentRejectedException extends RuntimeException {

    private final ConsentErrorKind errorKind;

    public ConsentRejectedException(ConsentErrorKind errorKind, String message) {
        super("Consent rejected (" + errorKind + "): " + message);
        this.errorKind = errorKind;
    }

    public ConsentErrorKind getErrorKind() {
        return errorKind;
    }
}
