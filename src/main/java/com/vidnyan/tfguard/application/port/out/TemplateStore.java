package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.session.TemplateVersion;
import com.vidnyan.tfguard.domain.session.VersionAuthor;

import java.util.List;
import java.util.Optional;

/**
 * Port for template content and its version history.
 *
 * <p>Version numbers are allocated by the store: for each template they start
 * at 1 and increase by one per {@link #createVersion} call, even when called
 * concurrently.
 */
public interface TemplateStore {

    Optional<String> getContent(String templateId);

    void setContent(String templateId, String content);

    Optional<TemplateVersion> getLatestVersion(String templateId);

    Optional<TemplateVersion> findVersion(String templateId, int version);

    /**
     * History, oldest first.
     */
    List<TemplateVersion> listVersions(String templateId);

    /**
     * Append a version numbered {@code latest + 1}.
     */
    TemplateVersion createVersion(String templateId, String content, String changeLog, VersionAuthor createdBy);

    /**
     * Create version 1 with the given content when the template has no history yet.
     *
     * @return the existing or new version 1
     */
    TemplateVersion createBaselineIfAbsent(String templateId, String content, String changeLog, VersionAuthor createdBy);
}
