package com.vidnyan.tfguard.adapter.in.web;

import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.in.CompareUseCase;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.delta.DiffResult;
import com.vidnyan.tfguard.domain.model.LiveResource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for audits and version comparison.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuditController {

    private final AuditUseCase auditUseCase;
    private final CompareUseCase compareUseCase;

    @PostMapping("/audit")
    public AuditResult audit(@RequestBody AuditRequest request) {
        log.info("Received audit request for {}", request.templateId() != null ? request.templateId() : "inline content");
        return auditUseCase.audit(request.templateId(), request.content(), request.provider());
    }

    @GetMapping("/templates/{templateId}/audits/latest")
    public AuditResult latestAudit(@PathVariable String templateId) {
        return auditUseCase.getLatestReport(templateId);
    }

    @GetMapping("/templates/{templateId}/audits")
    public List<AuditResult> audits(@PathVariable String templateId) {
        return auditUseCase.listReports(templateId);
    }

    @PostMapping("/audit/live")
    public AuditResult auditLive(@RequestBody LiveAuditRequest request) {
        List<LiveResource> resources = request.resources() != null ? request.resources() : List.of();
        return auditUseCase.auditLiveResources(resources, request.provider(), request.region());
    }

    @PostMapping("/compare")
    public DiffResult compare(@RequestBody CompareRequest request) {
        return compareUseCase.compare(request.oldContent(), request.newContent(), request.provider());
    }

    public record AuditRequest(
        String templateId,
        String content,
        String provider
    ) {}

    public record LiveAuditRequest(
        List<LiveResource> resources,
        String provider,
        String region
    ) {}

    public record CompareRequest(
        String oldContent,
        String newContent,
        String provider
    ) {}
}
