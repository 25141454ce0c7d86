package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.audit.AuditResult;

import java.util.List;
import java.util.Optional;

/**
 * Port for point-in-time audit reports of stored templates.
 */
public interface AuditReportRepository {

    void save(AuditResult report);

    Optional<AuditResult> findLatest(String templateId);

    /**
     * Reports of one template, newest first.
     */
    List<AuditResult> findByTemplateId(String templateId);
}
