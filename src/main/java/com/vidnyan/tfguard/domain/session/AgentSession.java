package com.vidnyan.tfguard.domain.session;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A plan/review/apply conversation about one template.
 *
 * <p>The status doubles as the apply gate: moving between states only happens
 * through {@link #compareAndSetStatus}, so two callers cannot both leave REVIEWING.
 */
@Getter
public class AgentSession {

    private final String id;
    private final String templateId;
    private final String provider;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.PLANNING);

    @Setter
    private volatile ChangePlan changePlan = ChangePlan.empty();
    @Setter
    private volatile ScoreSnapshot originalScore;
    @Setter
    private volatile ScoreSnapshot projectedScore;
    @Setter
    private volatile double totalSavings;
    @Setter
    private volatile List<String> appliedChangeIds = List.of();
    @Setter
    private volatile Instant completedAt;
    @Setter
    private volatile String errorMessage;

    public AgentSession(String id, String templateId, String provider, Instant createdAt) {
        this.id = id;
        this.templateId = templateId;
        this.provider = provider;
        this.createdAt = createdAt;
    }

    public static AgentSession start(String templateId, String provider) {
        return new AgentSession(UUID.randomUUID().toString(), templateId, provider, Instant.now());
    }

    public SessionStatus getStatus() {
        return status.get();
    }

    /**
     * Atomically move from {@code expected} to {@code next}.
     *
     * @return false when the session was not in {@code expected}
     */
    public boolean compareAndSetStatus(SessionStatus expected, SessionStatus next) {
        return status.compareAndSet(expected, next);
    }
}
