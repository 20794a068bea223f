package com.demo.policy.service;

/** Malformed lookup or revoke parameters. Carries a stable code for the client. */
public class InvalidRequestException extends RuntimeException {

    private final String code;

    public InvalidRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
