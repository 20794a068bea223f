package com.demo.policy.controller;

import com.demo.policy.controller.dto.PolicyDtos;
import com.demo.policy.service.ConsentService;
import com.demo.policy.service.dto.ConsentStats;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Operator endpoints. Access control is left to the gateway in front of the service.
 */
@RestController
@RequestMapping("/api/policy/admin")
@Validated
@RequiredArgsConstructor
public class PolicyAdminController {

    private final ConsentService consentService;

    @GetMapping("/stats")
    public ConsentStats stats(
            @RequestParam(defaultValue = "${policy.stats.trend-days:7}") @Min(1) @Max(365) int days,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return consentService.stats(days, startDate, endDate);
    }

    @PostMapping("/cleanup")
    public PolicyDtos.CleanupResponse cleanup() {
        return new PolicyDtos.CleanupResponse(consentService.sweep());
    }
}
