package com.vidnyan.tfguard.application.port.in;

import com.vidnyan.tfguard.domain.session.AgentSession;
import com.vidnyan.tfguard.domain.session.ApplyResult;
import com.vidnyan.tfguard.domain.session.TemplateVersion;

import java.util.Collection;
import java.util.List;

/**
 * Plan, review and apply remediation for a stored template.
 */
public interface AgentUseCase {

    /**
     * Store or replace the current content of a template. History is untouched.
     */
    void saveTemplate(String templateId, String content);

    String getTemplateContent(String templateId);

    /**
     * Audit the template, propose changes and leave the session in REVIEWING.
     */
    AgentSession analyzeAndPlan(String templateId, String provider);

    /**
     * Apply the accepted changes of a REVIEWING session.
     *
     * @throws com.vidnyan.tfguard.domain.exception.SessionStateConflictException
     *         if the session is not REVIEWING or another apply won the race
     */
    ApplyResult applyChanges(String sessionId, Collection<String> acceptedChangeIds);

    AgentSession cancelSession(String sessionId);

    AgentSession getSession(String sessionId);

    List<AgentSession> listSessions(String templateId);

    List<TemplateVersion> getTemplateVersions(String templateId);

    /**
     * Make an old version current again by appending new versions.
     *
     * @return the version that now holds the restored content
     */
    TemplateVersion restoreTemplateVersion(String templateId, int version);
}
