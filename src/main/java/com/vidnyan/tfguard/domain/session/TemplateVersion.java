package com.vidnyan.tfguard.domain.session;

import java.time.Instant;

/**
 * Immutable entry in a template's append-only history.
 */
public record TemplateVersion(
    String id,
    String templateId,
    int version,
    String content,
    String changeLog,
    VersionAuthor createdBy,
    Instant createdAt
) {
}
