package com.demo.policy.service;

/**
 * Audit-only request context. Never consulted when validating a submission.
 */
public record ClientMeta(String userAgent, String ipAddress) {

    public static final ClientMeta NONE = new ClientMeta(null, null);

    /** Width of the {@code ip_address} column. */
    public static final int MAX_IP_ADDRESS_LENGTH = 64;

    public ClientMeta truncated(int maxUserAgentLength) {
        String ua = cut(userAgent, maxUserAgentLength);
        String ip = cut(ipAddress, MAX_IP_ADDRESS_LENGTH);
        if (ua == userAgent && ip == ipAddress) return this;
        return new ClientMeta(ua, ip);
    }

    private static String cut(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
