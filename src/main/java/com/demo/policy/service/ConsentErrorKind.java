package com.demo.policy.service;

/** Rejection reasons, in the order the validation stages run. */
public enum ConsentErrorKind {
    STRUCTURE_INVALID,
    TIMESTAMP_OUT_OF_WINDOW,
    CHECKSUM_MISMATCH,
    VERSION_MISMATCH
}
