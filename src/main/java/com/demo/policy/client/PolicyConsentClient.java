package com.demo.policy.client;

import com.demo.policy.service.ConsentChecksum;
import com.demo.policy.service.ConsentErrorKind;
import com.demo.policy.service.ConsentPolicy;
import com.demo.policy.service.ConsentPort;
import com.demo.policy.service.EnvironmentSignals;
import com.demo.policy.service.FingerprintGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Talks to the policy API the way the browser does: fingerprint + checksum in, consent id out.
 */
@Slf4j
@Component
public class PolicyConsentClient implements ConsentPort {

    private final RestTemplate rest;
    private final String base;
    private final FingerprintGenerator fingerprints;
    private final ConsentChecksum checksum;
    private final ConsentPolicy policy;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public PolicyConsentClient(RestTemplate rest,
                               @Value("${consent.client.base-url:http://localhost:8080}") String baseUrl,
                               FingerprintGenerator fingerprints,
                               ConsentChecksum checksum,
                               ConsentPolicy policy,
                               Clock clock,
                               ObjectMapper objectMapper) {
        this.rest = rest;
        this.base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length()-1) : baseUrl;
        this.fingerprints = fingerprints;
        this.checksum = checksum;
        this.policy = policy;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public String fingerprintOf(EnvironmentSignals signals) {
        return fingerprints.generate(signals);
    }

    /** Any failure to reach the API counts as "no consent". */
    @Override
    public boolean hasConsent(String fingerprint, String policyVersion) {
        URI uri = UriComponentsBuilder.fromHttpUrl(base + "/api/policy/check")
                .queryParam("fingerprint", fingerprint)
                .queryParam("policyVersion", policyVersion)
                .encode()
                .build()
                .toUri();
        try {
            Map<?,?> res = rest.getForObject(uri, Map.class);
            Object valid = (res != null) ? res.get("hasValidConsent") : null;
            return Boolean.TRUE.equals(valid);
        } catch (RestClientException ex) {
            log.warn("Consent check failed, treating as no consent: {}", ex.toString());
            return false;
        }
    }

    @Override
    public String grantConsent(EnvironmentSignals signals) {
        String fingerprint = fingerprintOf(signals);
        long submittedAt = clock.millis();
        String version = policy.activeVersion();

        Map<String, Object> body = new HashMap<>();
        body.put("submittedAt", submittedAt);
        body.put("policyVersion", version);
        body.put("fingerprint", fingerprint);
        body.put("checksum", checksum.compute(submittedAt, version, fingerprint));
        body.put("userAgent", signals.userAgent());

        HttpHeaders h = new HttpHeaders(); h.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<Map> resp = rest.postForEntity(base + "/api/policy/verify", new HttpEntity<>(body, h), Map.class);
            Map<?,?> m = resp.getBody();
            Object id = (m != null) ? m.get("id") : null;
            if (id == null) {
                throw new IllegalStateException("Consent API returned no id");
            }
            return id.toString();
        } catch (HttpClientErrorException.BadRequest ex) {
            Map<?,?> m = readBody(ex.getResponseBodyAsString());
            Object kind = m.get("errorKind");
            Object message = m.get("message");
            throw new ConsentRejectedException(errorKind(kind), String.valueOf(message));
        }
    }

    // unknown kinds from a newer server are reported as structural
    private static ConsentErrorKind errorKind(Object kind) {
        if (kind == null) return ConsentErrorKind.STRUCTURE_INVALID;
        try {
            return ConsentErrorKind.valueOf(kind.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown consent error kind from server: {}", kind);
            return ConsentErrorKind.STRUCTURE_INVALID;
        }
    }

    private Map<?,?> readBody(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, Map.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable rejection body: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    @Override
    public int revokeConsent(String fingerprint, String policyVersion) {
        Map<String, Object> body = new HashMap<>();
        body.put("fingerprint", fingerprint);
        if (policyVersion != null) body.put("policyVersion", policyVersion);

        HttpHeaders h = new HttpHeaders(); h.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> resp = rest.postForEntity(base + "/api/policy/revoke", new HttpEntity<>(body, h), Map.class);
        Map<?,?> m = resp.getBody();
        Object count = (m != null) ? m.get("revokedCount") : null;
        return (count instanceof Number n) ? n.intValue() : 0;
    }
}
