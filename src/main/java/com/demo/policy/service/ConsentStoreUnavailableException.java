package com.demo.policy.service;

/** Consent storage could not be reached, even after the retry. */
public class ConsentStoreUnavailableException extends RuntimeException {

    public ConsentStoreUnavailableException(String operation, Throwable cause) {
        super("Consent store unavailable during " + operation, cause);
    }
}
