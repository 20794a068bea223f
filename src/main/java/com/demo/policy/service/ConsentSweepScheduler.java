package com.demo.policy.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic removal of expired and revoked consents. A skipped run only lets storage grow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "policy.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ConsentSweepScheduler {

    private final ConsentService consentService;

    @Scheduled(fixedDelayString = "${policy.sweep.interval:PT1H}",
               initialDelayString = "${policy.sweep.initial-delay:PT1M}")
    public void sweepExpired() {
        log.debug("Scheduled consent sweep starting");
        try {
            consentService.sweep();
        } catch (ConsentStoreUnavailableException e) {
            log.warn("Scheduled consent sweep skipped: {}", e.getMessage());
        }
    }
}
