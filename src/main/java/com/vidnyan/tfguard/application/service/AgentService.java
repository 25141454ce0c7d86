package com.vidnyan.tfguard.application.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.vidnyan.tfguard.application.port.in.AgentUseCase;
import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.in.RemediationUseCase;
import com.vidnyan.tfguard.application.port.out.SessionRepository;
import com.vidnyan.tfguard.application.port.out.TemplateStore;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.exception.ParseFailureException;
import com.vidnyan.tfguard.domain.exception.SessionStateConflictException;
import com.vidnyan.tfguard.domain.remediation.ChangeStatus;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import com.vidnyan.tfguard.domain.remediation.Remediation;
import com.vidnyan.tfguard.domain.session.AgentChange;
import com.vidnyan.tfguard.domain.session.AgentSession;
import com.vidnyan.tfguard.domain.session.ApplyResult;
import com.vidnyan.tfguard.domain.session.ChangeOutcome;
import com.vidnyan.tfguard.domain.session.ChangePlan;
import com.vidnyan.tfguard.domain.session.ScoreSnapshot;
import com.vidnyan.tfguard.domain.session.SessionStatus;
import com.vidnyan.tfguard.domain.session.TemplateVersion;
import com.vidnyan.tfguard.domain.session.VersionAuthor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Change-plan orchestrator. Drives an agent session through
 * plan, review and apply against the stored template.
 *
 * <p>The REVIEWING to APPLYING move is a compare-and-set on the session, and
 * a per-template lock keeps two sessions of the same template from writing
 * at once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentService implements AgentUseCase {

    static final String BASELINE_CHANGE_LOG = "Original template (pre-agent)";

    private final AuditUseCase auditUseCase;
    private final RemediationUseCase remediationUseCase;
    private final TemplateStore templateStore;
    private final SessionRepository sessionRepository;
    private final TfGuardProperties properties;

    // Weak values: an unused lock is collected, a held one stays shared.
    private final LoadingCache<String, ReentrantLock> templateLocks = Caffeine.newBuilder()
            .weakValues()
            .build(templateId -> new ReentrantLock());

    @Override
    public void saveTemplate(String templateId, String content) {
        if (content == null) {
            throw new ParseFailureException("Template content is required");
        }
        templateStore.setContent(templateId, content);
        log.info("Stored template {} ({} chars)", templateId, content.length());
    }

    @Override
    public String getTemplateContent(String templateId) {
        return requireContent(templateId);
    }

    @Override
    public AgentSession analyzeAndPlan(String templateId, String provider) {
        String content = requireContent(templateId);
        String effectiveProvider = provider == null || provider.isBlank()
                ? properties.getAudit().getProvider()
                : provider;

        AgentSession session = sessionRepository.save(AgentSession.start(templateId, effectiveProvider));
        log.info("Planning session {} for template {}", session.getId(), templateId);

        try {
            AuditResult audit = auditUseCase.audit(templateId, content, effectiveProvider);
            List<Remediation> remediations = remediationUseCase.generateBatchFixes(content, audit);
            ChangePlan plan = new ChangePlan(remediations.stream().map(AgentChange::from).toList());

            int originalSecurity = audit.score();
            double originalCost = audit.costBreakdown().totalMonthly();
            int securityGain = plan.changes().stream()
                    .mapToInt(c -> c.impact().securityScoreChange())
                    .sum();
            double savings = CostBreakdown.round2(plan.changes().stream()
                    .mapToDouble(c -> Math.abs(c.impact().monthlyCostChange()))
                    .sum());

            session.setChangePlan(plan);
            session.setOriginalScore(new ScoreSnapshot(originalSecurity, originalCost));
            session.setProjectedScore(new ScoreSnapshot(
                    Math.min(100, originalSecurity + securityGain),
                    CostBreakdown.round2(Math.max(0.0, originalCost - savings))));
            session.setTotalSavings(savings);

            if (!session.compareAndSetStatus(SessionStatus.PLANNING, SessionStatus.REVIEWING)) {
                throw SessionStateConflictException.expected(session.getId(), SessionStatus.PLANNING, session.getStatus());
            }
            log.info("Session {} ready for review: {} changes ({} manual), score {} -> {}",
                    session.getId(), plan.changes().size(), plan.placeholderCount(),
                    originalSecurity, session.getProjectedScore().securityScore());
            return sessionRepository.save(session);
        } catch (RuntimeException e) {
            log.error("Planning failed for session {}: {}", session.getId(), e.getMessage());
            session.compareAndSetStatus(SessionStatus.PLANNING, SessionStatus.CANCELLED);
            session.setErrorMessage(e.getMessage());
            session.setCompletedAt(Instant.now());
            sessionRepository.save(session);
            throw e;
        }
    }

    @Override
    public ApplyResult applyChanges(String sessionId, Collection<String> acceptedChangeIds) {
        AgentSession session = getSession(sessionId);
        if (!session.compareAndSetStatus(SessionStatus.REVIEWING, SessionStatus.APPLYING)) {
            throw SessionStateConflictException.expected(sessionId, SessionStatus.REVIEWING, session.getStatus());
        }

        ReentrantLock lock = lockFor(session.getTemplateId());
        if (!lock.tryLock()) {
            session.compareAndSetStatus(SessionStatus.APPLYING, SessionStatus.REVIEWING);
            throw new SessionStateConflictException(
                    "Another session is applying changes to template " + session.getTemplateId());
        }
        try {
            return apply(session, Set.copyOf(acceptedChangeIds));
        } catch (RuntimeException e) {
            log.error("Apply failed for session {}, back to review: {}", sessionId, e.getMessage());
            session.compareAndSetStatus(SessionStatus.APPLYING, SessionStatus.REVIEWING);
            session.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private ApplyResult apply(AgentSession session, Set<String> accepted) {
        String original = requireContent(session.getTemplateId());
        String buffer = original;
        List<ChangeOutcome> outcomes = new ArrayList<>();
        List<String> appliedIds = new ArrayList<>();
        List<String> appliedCodes = new ArrayList<>();

        for (AgentChange change : session.getChangePlan().changes()) {
            if (!accepted.contains(change.id())) {
                continue;
            }
            FixValidation validation = remediationUseCase.validateFix(buffer, change.diff());
            if (validation.valid()) {
                buffer = validation.resultContent();
                appliedIds.add(change.id());
                appliedCodes.add(change.policyCode());
                outcomes.add(ChangeOutcome.applied(change));
            } else {
                log.warn("Skipping change {} ({}): {}", change.id(), change.policyCode(), validation.error());
                outcomes.add(ChangeOutcome.failed(change, validation.error()));
            }
        }

        if (appliedIds.isEmpty()) {
            session.compareAndSetStatus(SessionStatus.APPLYING, SessionStatus.REVIEWING);
            session.setErrorMessage("No changes could be applied");
            sessionRepository.save(session);
            log.warn("Session {}: none of {} accepted changes applied", session.getId(), accepted.size());
            return new ApplyResult(session.getId(), SessionStatus.REVIEWING, 0, List.of(), outcomes, null);
        }

        String templateId = session.getTemplateId();
        templateStore.createBaselineIfAbsent(templateId, original, BASELINE_CHANGE_LOG, VersionAuthor.USER);
        TemplateVersion version = templateStore.createVersion(templateId, buffer,
                "Agent applied " + appliedIds.size() + " changes: " + String.join(", ", appliedCodes),
                VersionAuthor.AGENT);
        templateStore.setContent(templateId, buffer);

        Set<String> applied = new HashSet<>(appliedIds);
        session.setChangePlan(session.getChangePlan().map(change -> {
            if (applied.contains(change.id())) {
                return change.withStatus(ChangeStatus.APPLIED);
            }
            return change.withStatus(accepted.contains(change.id()) ? ChangeStatus.ACCEPTED : ChangeStatus.REJECTED);
        }));
        session.setAppliedChangeIds(List.copyOf(appliedIds));
        session.setCompletedAt(Instant.now());
        session.setErrorMessage(null);
        session.compareAndSetStatus(SessionStatus.APPLYING, SessionStatus.COMPLETED);
        sessionRepository.save(session);

        log.info("Session {} applied {} changes to {}, now version {}",
                session.getId(), appliedIds.size(), templateId, version.version());
        return new ApplyResult(session.getId(), SessionStatus.COMPLETED, appliedIds.size(),
                appliedIds, outcomes, version.version());
    }

    @Override
    public AgentSession cancelSession(String sessionId) {
        AgentSession session = getSession(sessionId);
        if (!session.compareAndSetStatus(SessionStatus.REVIEWING, SessionStatus.CANCELLED)) {
            throw SessionStateConflictException.expected(sessionId, SessionStatus.REVIEWING, session.getStatus());
        }
        session.setCompletedAt(Instant.now());
        log.info("Session {} cancelled", sessionId);
        return sessionRepository.save(session);
    }

    @Override
    public AgentSession getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> NotFoundException.of("Session", sessionId));
    }

    @Override
    public List<AgentSession> listSessions(String templateId) {
        return sessionRepository.findByTemplateId(templateId);
    }

    @Override
    public List<TemplateVersion> getTemplateVersions(String templateId) {
        requireContent(templateId);
        return templateStore.listVersions(templateId);
    }

    @Override
    public TemplateVersion restoreTemplateVersion(String templateId, int version) {
        TemplateVersion target = templateStore.findVersion(templateId, version)
                .orElseThrow(() -> NotFoundException.of("Version", templateId + "@" + version));

        ReentrantLock lock = lockFor(templateId);
        lock.lock();
        try {
            String current = requireContent(templateId);
            templateStore.createVersion(templateId, current,
                    "Pre-restore snapshot (before reverting to version " + version + ")", VersionAuthor.USER);
            TemplateVersion restored = templateStore.createVersion(templateId, target.content(),
                    "Restored from version " + version, VersionAuthor.USER);
            templateStore.setContent(templateId, target.content());
            log.info("Template {} restored from version {} as version {}", templateId, version, restored.version());
            return restored;
        } finally {
            lock.unlock();
        }
    }

    private String requireContent(String templateId) {
        return templateStore.getContent(templateId)
                .orElseThrow(() -> NotFoundException.of("Template", templateId));
    }

    private ReentrantLock lockFor(String templateId) {
        return templateLocks.get(templateId);
    }
}
