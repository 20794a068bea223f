package com.demo.policy.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

final class ClientRequests {

    private ClientRequests() {}

    /** Best-effort client address for the audit log; first X-Forwarded-For hop wins. */
    static String clientIp(HttpServletRequest req) {
        String forwarded = req.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = req.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return req.getRemoteAddr();
    }
}
