package com.vidnyan.tfguard.adapter.out.persistence;

import com.vidnyan.tfguard.application.port.out.AuditReportRepository;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit reports held in memory, in the order they were saved.
 */
@Component
public class InMemoryAuditReportRepository implements AuditReportRepository {

    private final Map<String, List<AuditResult>> reports = new ConcurrentHashMap<>();

    @Override
    public void save(AuditResult report) {
        if (report.templateId() == null) {
            throw new IllegalArgumentException("Audit report needs a template id");
        }
        reports.computeIfAbsent(report.templateId(), id -> new CopyOnWriteArrayList<>()).add(report);
    }

    @Override
    public Optional<AuditResult> findLatest(String templateId) {
        List<AuditResult> history = reports.getOrDefault(templateId, List.of());
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public List<AuditResult> findByTemplateId(String templateId) {
        List<AuditResult> newestFirst = new ArrayList<>(reports.getOrDefault(templateId, List.of()));
        Collections.reverse(newestFirst);
        return newestFirst;
    }
}
