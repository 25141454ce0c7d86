package com.vidnyan.tfguard.adapter.out.persistence;

import com.vidnyan.tfguard.application.port.out.SessionRepository;
import com.vidnyan.tfguard.domain.session.AgentSession;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent sessions held in memory. Sessions are mutable, so saving the same
 * instance again is a no-op.
 */
@Component
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    @Override
    public AgentSession save(AgentSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public Optional<AgentSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<AgentSession> findByTemplateId(String templateId) {
        return sessions.values().stream()
                .filter(s -> s.getTemplateId().equals(templateId))
                .sorted(Comparator.comparing(AgentSession::getCreatedAt).reversed())
                .toList();
    }
}
