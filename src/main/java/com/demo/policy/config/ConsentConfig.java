package com.demo.policy.config;

import com.demo.policy.service.ConsentChecksum;
import com.demo.policy.service.ConsentPolicy;
import com.demo.policy.service.ConsentValidator;
import com.demo.policy.service.FingerprintGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class ConsentConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConsentPolicy consentPolicy(
            @Value("${policy.active-version:2.0}") String activeVersion,
            @Value("${policy.freshness-window:PT20S}") Duration freshnessWindow,
            @Value("${policy.validity-period:P30D}") Duration validityPeriod,
            @Value("${policy.checksum-salt:hapxtts_secret_salt}") String checksumSalt,
            @Value("${policy.checksum-length:8}") int checksumLength,
            @Value("${policy.limits.fingerprint:100}") int maxFingerprint,
            @Value("${policy.limits.version:50}") int maxVersion,
            @Value("${policy.limits.checksum:100}") int maxChecksum,
            @Value("${policy.limits.user-agent:500}") int maxUserAgent) {
        return new ConsentPolicy(activeVersion.trim(), freshnessWindow, validityPeriod, checksumSalt, checksumLength,
                maxFingerprint, maxVersion, maxChecksum, maxUserAgent);
    }

    @Bean
    public ConsentChecksum consentChecksum(ConsentPolicy policy) {
        return new ConsentChecksum(policy.checksumSalt(), policy.checksumLength());
    }

    @Bean
    public ConsentValidator consentValidator(ConsentPolicy policy, ConsentChecksum checksum) {
        return new ConsentValidator(policy, checksum);
    }

    @Bean
    public FingerprintGenerator fingerprintGenerator(@Value("${policy.fingerprint-length:8}") int length) {
        return new FingerprintGenerator(length);
    }

    /** Storage calls get one retry (two attempts in total) on connection-type failures. */
    @Bean
    public RetryTemplate consentStoreRetry(@Value("${policy.store.retry-backoff:PT0.2S}") Duration backoff) {
        return RetryTemplate.builder()
                .maxAttempts(2)
                .fixedBackoff(Math.max(1L, backoff.toMillis()))
                .retryOn(List.of(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class))
                .traversingCauses()
                .build();
    }
}
