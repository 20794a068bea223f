package com.demo.policy.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    private HashUtil() {}

    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] b = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(b.length * 2);
            for (byte x : b) sb.append(String.format("%02x", x));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Lowercase SHA-256 hex digest cut down to the first {@code length} characters. */
    public static String sha256Prefix(String input, int length) {
        if (length < 1 || length > 64) {
            throw new IllegalArgumentException("length must be within 1..64: " + length);
        }
        return sha256Hex(input).substring(0, length);
    }
}
