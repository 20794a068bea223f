package com.demo.policy.service.dto;

import java.time.LocalDate;

public record DailyCount(LocalDate day, long count) {
}
