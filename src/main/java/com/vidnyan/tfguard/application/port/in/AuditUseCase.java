package com.vidnyan.tfguard.application.port.in;

import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.model.LiveResource;

import java.util.List;

/**
 * Primary use case: audit configuration for security and cost issues.
 */
public interface AuditUseCase {

    /**
     * Audit configuration text.
     *
     * @param templateId identifier echoed in the result, may be null
     * @param content configuration text
     * @param provider cloud provider, e.g. {@code aws}
     */
    AuditResult audit(String templateId, String content, String provider);

    default AuditResult audit(String content, String provider) {
        return audit(null, content, provider);
    }

    /**
     * Audit resources reported by an account inventory.
     */
    AuditResult auditLiveResources(List<LiveResource> resources, String provider, String region);

    /**
     * Most recent stored report of a template. Only audits run with a
     * template id are stored.
     *
     * @throws com.vidnyan.tfguard.domain.exception.NotFoundException when the template was never audited
     */
    AuditResult getLatestReport(String templateId);

    /**
     * Stored reports of a template, newest first.
     */
    List<AuditResult> listReports(String templateId);
}
