package com.demo.policy.controller;

import com.demo.policy.controller.dto.PolicyDtos;
import com.demo.policy.service.ClientMeta;
import com.demo.policy.service.ConsentErrorKind;
import com.demo.policy.service.ConsentService;
import com.demo.policy.service.dto.CheckResult;
import com.demo.policy.service.dto.PolicyInfo;
import com.demo.policy.service.dto.VerifyOutcome;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/policy")
@RequiredArgsConstructor
public class PolicyConsentController {

    private final ConsentService consentService;

    @PostMapping("/verify")
    public ResponseEntity<PolicyDtos.VerifyResponse> verify(@RequestBody PolicyDtos.VerifyRequest body,
                                                            HttpServletRequest req) {
        String userAgent = StringUtils.hasText(body.userAgent) ? body.userAgent : req.getHeader("User-Agent");
        ClientMeta meta = new ClientMeta(userAgent, ClientRequests.clientIp(req));

        VerifyOutcome out = consentService.verify(body.toSubmission(), meta);
        if (out.accepted()) {
            return ResponseEntity.ok(PolicyDtos.VerifyResponse.accepted(out.id(), out.expiresAt()));
        }
        PolicyDtos.VerifyResponse rejected = PolicyDtos.VerifyResponse.rejected(out.errorKind(), out.message());
        if (out.errorKind() == ConsentErrorKind.VERSION_MISMATCH) {
            rejected.currentVersion = consentService.policyInfo().version();
        }
        return ResponseEntity.badRequest().body(rejected);
    }

    // "version" is what the older browser client sends
    @GetMapping("/check")
    public ResponseEntity<PolicyDtos.CheckResponse> check(
            @RequestParam(required = false) String fingerprint,
            @RequestParam(required = false) String policyVersion,
            @RequestParam(required = false) String version) {
        CheckResult result = consentService.check(fingerprint, policyVersion != null ? policyVersion : version);
        PolicyDtos.CheckResponse body = PolicyDtos.CheckResponse.from(result, consentService.policyInfo().version());
        return ResponseEntity.status(result.storeAvailable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
    }

    @PostMapping("/revoke")
    public PolicyDtos.RevokeResponse revoke(@RequestBody PolicyDtos.RevokeRequest body) {
        return new PolicyDtos.RevokeResponse(consentService.revoke(body.fingerprint, body.policyVersion));
    }

    @GetMapping("/version")
    public PolicyInfo version() {
        return consentService.policyInfo();
    }

    /** Unreadable JSON or wrongly typed fields. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> unreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        log.warn("Unreadable policy request on {}: {}", req.getRequestURI(), ex.getMostSpecificCause().getMessage());
        if (req.getRequestURI().endsWith("/verify")) {
            return ResponseEntity.badRequest().body(
                    PolicyDtos.VerifyResponse.rejected(ConsentErrorKind.STRUCTURE_INVALID, "Malformed consent payload"));
        }
        return ResponseEntity.badRequest().body(Map.of(
                "status", 400,
                "code", "INVALID_BODY",
                "message", "Malformed request body"));
    }
}
