package com.vidnyan.tfguard.adapter.out.persistence;

import com.vidnyan.tfguard.application.port.out.TemplateStore;
import com.vidnyan.tfguard.domain.session.TemplateVersion;
import com.vidnyan.tfguard.domain.session.VersionAuthor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template contents and histories held in memory.
 * Each history list is guarded by its own monitor.
 */
@Slf4j
@Component
public class InMemoryTemplateStore implements TemplateStore {

    private final Map<String, String> contents = new ConcurrentHashMap<>();
    private final Map<String, List<TemplateVersion>> histories = new ConcurrentHashMap<>();

    @Override
    public Optional<String> getContent(String templateId) {
        return Optional.ofNullable(contents.get(templateId));
    }

    @Override
    public void setContent(String templateId, String content) {
        contents.put(templateId, content);
    }

    @Override
    public Optional<TemplateVersion> getLatestVersion(String templateId) {
        List<TemplateVersion> history = historyOf(templateId);
        synchronized (history) {
            return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
        }
    }

    @Override
    public Optional<TemplateVersion> findVersion(String templateId, int version) {
        List<TemplateVersion> history = historyOf(templateId);
        synchronized (history) {
            return history.stream().filter(v -> v.version() == version).findFirst();
        }
    }

    @Override
    public List<TemplateVersion> listVersions(String templateId) {
        List<TemplateVersion> history = historyOf(templateId);
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    @Override
    public TemplateVersion createVersion(String templateId, String content, String changeLog, VersionAuthor createdBy) {
        List<TemplateVersion> history = historyOf(templateId);
        synchronized (history) {
            return append(history, templateId, content, changeLog, createdBy);
        }
    }

    @Override
    public TemplateVersion createBaselineIfAbsent(String templateId, String content, String changeLog, VersionAuthor createdBy) {
        List<TemplateVersion> history = historyOf(templateId);
        synchronized (history) {
            if (!history.isEmpty()) {
                return history.get(0);
            }
            return append(history, templateId, content, changeLog, createdBy);
        }
    }

    private List<TemplateVersion> historyOf(String templateId) {
        return histories.computeIfAbsent(templateId, id -> new ArrayList<>());
    }

    private static TemplateVersion append(List<TemplateVersion> history, String templateId,
                                          String content, String changeLog, VersionAuthor createdBy) {
        TemplateVersion version = new TemplateVersion(
                UUID.randomUUID().toString(),
                templateId,
                history.size() + 1,
                content,
                changeLog,
                createdBy,
                Instant.now());
        history.add(version);
        log.debug("Template {} now at version {} ({})", templateId, version.version(), changeLog);
        return version;
    }
}
