package com.vidnyan.tfguard.adapter.in.web;

import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.in.RemediationUseCase;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import com.vidnyan.tfguard.domain.remediation.Remediation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for fix generation, validation and application.
 */
@RestController
@RequestMapping("/api/remediation")
@RequiredArgsConstructor
public class RemediationController {

    private final AuditUseCase auditUseCase;
    private final RemediationUseCase remediationUseCase;

    /**
     * Audit the content and build a fix for one of its violations.
     */
    @PostMapping("/fix")
    public Remediation fix(@RequestBody FixRequest request) {
        AuditResult audit = auditUseCase.audit(request.content(), request.provider());
        PolicyViolations group = audit.findGroup(request.policyCode())
                .orElseThrow(() -> NotFoundException.of("Violation", request.policyCode()));
        PolicyResult violation = group.results().stream()
                .filter(r -> r.resourceRef().equals(request.resourceRef()))
                .findFirst()
                .orElseThrow(() -> NotFoundException.of("Violation", request.policyCode() + ":" + request.resourceRef()));
        return remediationUseCase.generateFix(request.content(), group, violation);
    }

    @PostMapping("/batch")
    public List<Remediation> batch(@RequestBody BatchRequest request) {
        AuditResult audit = auditUseCase.audit(request.content(), request.provider());
        return remediationUseCase.generateBatchFixes(request.content(), audit);
    }

    @PostMapping("/validate")
    public FixValidation validate(@RequestBody PatchRequest request) {
        return remediationUseCase.validateFix(request.content(), new FixDiff(request.before(), request.after()));
    }

    @PostMapping("/apply")
    public PatchResponse apply(@RequestBody PatchRequest request) {
        FixDiff diff = new FixDiff(request.before(), request.after());
        FixValidation validation = remediationUseCase.validateFix(request.content(), diff);
        if (!validation.valid()) {
            throw new IllegalArgumentException(validation.error());
        }
        return new PatchResponse(remediationUseCase.applyFix(request.content(), diff));
    }

    public record FixRequest(
        String content,
        String provider,
        String policyCode,
        String resourceRef
    ) {}

    public record BatchRequest(
        String content,
        String provider
    ) {}

    public record PatchRequest(
        String content,
        String before,
        String after
    ) {}

    public record PatchResponse(String content) {}
}
