package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.session.AgentSession;

import java.util.List;
import java.util.Optional;

/**
 * Port for agent session storage.
 */
public interface SessionRepository {

    AgentSession save(AgentSession session);

    Optional<AgentSession> findById(String sessionId);

    /**
     * Sessions of one template, newest first.
     */
    List<AgentSession> findByTemplateId(String templateId);
}
