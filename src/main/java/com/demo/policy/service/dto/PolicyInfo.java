package com.demo.policy.service.dto;

public record PolicyInfo(String version, long validityDays, long freshnessWindowSeconds) {
}
