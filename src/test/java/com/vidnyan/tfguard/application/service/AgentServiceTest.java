package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.adapter.out.parser.HclConfigParser;
import com.vidnyan.tfguard.adapter.out.patch.SubstringPatchStrategy;
import com.vidnyan.tfguard.adapter.out.persistence.InMemoryAuditReportRepository;
import com.vidnyan.tfguard.adapter.out.persistence.InMemorySessionRepository;
import com.vidnyan.tfguard.adapter.out.persistence.InMemoryTemplateStore;
import com.vidnyan.tfguard.adapter.out.policy.BuiltInPolicyRepository;
import com.vidnyan.tfguard.adapter.out.policy.InMemoryPolicyActivation;
import com.vidnyan.tfguard.adapter.out.pricing.AwsPricingService;
import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.out.FixSuggester;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.exception.ParseFailureException;
import com.vidnyan.tfguard.domain.exception.SessionStateConflictException;
import com.vidnyan.tfguard.domain.model.LiveResource;
import com.vidnyan.tfguard.domain.remediation.ChangeStatus;
import com.vidnyan.tfguard.domain.session.AgentChange;
import com.vidnyan.tfguard.domain.session.AgentSession;
import com.vidnyan.tfguard.domain.session.ApplyResult;
import com.vidnyan.tfguard.domain.session.SessionStatus;
import com.vidnyan.tfguard.domain.session.TemplateVersion;
import com.vidnyan.tfguard.domain.session.VersionAuthor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentServiceTest {

    private static final String TEMPLATE_ID = "tpl-1";

    /**
     * Fires SEC004 and COST005 on the same block, so applying one makes the
     * other's "before" text stale.
     */
    private static final String VOLUME = """
            resource "aws_ebs_volume" "data" {
              size = 100
              type = "gp2"
            }
            """;

    private static final FixSuggester NO_AI = new FixSuggester() {
        @Override
        public Suggestion suggestFix(String content, FixRequest request) {
            throw new IllegalStateException("not configured");
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };

    private ExecutorService policyExecutor;
    private ExecutorService aiExecutor;
    private InMemoryTemplateStore templateStore;
    private InMemorySessionRepository sessionRepository;
    private PolicyEngineService engine;
    private RemediationService remediation;
    private AgentService agent;

    @BeforeEach
    void setUp() {
        policyExecutor = Executors.newFixedThreadPool(4);
        aiExecutor = Executors.newSingleThreadExecutor();
        HclConfigParser parser = new HclConfigParser();
        BuiltInPolicyRepository policies = new BuiltInPolicyRepository(new InMemoryPolicyActivation(List.of()));
        TfGuardProperties properties = new TfGuardProperties();
        engine = new PolicyEngineService(parser, policies,
                new CostAnalysisService(new AwsPricingService()), new InMemoryAuditReportRepository(),
                policyExecutor, properties);
        remediation = new RemediationService(parser, new SubstringPatchStrategy(parser), NO_AI,
                policies, aiExecutor, properties);
        templateStore = new InMemoryTemplateStore();
        sessionRepository = new InMemorySessionRepository();
        agent = new AgentService(engine, remediation, templateStore, sessionRepository, properties);
        agent.saveTemplate(TEMPLATE_ID, VOLUME);
    }

    @AfterEach
    void tearDown() {
        policyExecutor.shutdownNow();
        aiExecutor.shutdownNow();
    }

    private static List<String> ids(AgentSession session) {
        return session.getChangePlan().changes().stream().map(AgentChange::id).toList();
    }

    private static AgentChange change(AgentSession session, String policyCode) {
        return session.getChangePlan().changes().stream()
                .filter(c -> c.policyCode().equals(policyCode))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void analyzeAndPlan_ShouldProposeFixesAndProjectScores() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        assertEquals(SessionStatus.REVIEWING, session.getStatus());
        assertEquals(List.of("SEC004", "COST005"),
                session.getChangePlan().changes().stream().map(AgentChange::policyCode).toList());
        assertTrue(session.getChangePlan().changes().stream().allMatch(c -> c.status() == ChangeStatus.PROPOSED));
        assertEquals(70, session.getOriginalScore().securityScore());
        assertEquals(85, session.getProjectedScore().securityScore());
        assertEquals(10.0, session.getOriginalScore().monthlyCost(), 0.001);
        assertEquals(8.0, session.getProjectedScore().monthlyCost(), 0.001);
        assertEquals(2.0, session.getTotalSavings(), 0.001);
        assertTrue(templateStore.listVersions(TEMPLATE_ID).isEmpty());
    }

    @Test
    void analyzeAndPlan_ShouldRejectUnknownTemplateWithoutCreatingSession() {
        assertThrows(NotFoundException.class, () -> agent.analyzeAndPlan("missing", "aws"));
        assertTrue(agent.listSessions("missing").isEmpty());
    }

    @Test
    void analyzeAndPlan_ShouldCancelSessionWhenAuditFails() {
        AuditUseCase failing = new AuditUseCase() {
            @Override
            public AuditResult audit(String templateId, String content, String provider) {
                throw new IllegalStateException("audit exploded");
            }

            @Override
            public AuditResult auditLiveResources(List<LiveResource> resources, String provider, String region) {
                throw new UnsupportedOperationException();
            }

            @Override
            public AuditResult getLatestReport(String templateId) {
                throw new UnsupportedOperationException();
            }

            @Override
            public List<AuditResult> listReports(String templateId) {
                return List.of();
            }
        };
        AgentService broken = new AgentService(failing, remediation, templateStore, sessionRepository,
                new TfGuardProperties());

        assertThrows(IllegalStateException.class, () -> broken.analyzeAndPlan(TEMPLATE_ID, null));

        AgentSession session = sessionRepository.findByTemplateId(TEMPLATE_ID).get(0);
        assertEquals(SessionStatus.CANCELLED, session.getStatus());
        assertEquals("audit exploded", session.getErrorMessage());
        assertNotNull(session.getCompletedAt());
    }

    @Test
    void applyChanges_ShouldSkipStaleChangeAndCompleteWithOthers() {
        // Arrange
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        // Act
        ApplyResult result = agent.applyChanges(session.getId(), ids(session));

        // Assert
        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals(1, result.appliedCount());
        assertEquals(List.of(change(session, "SEC004").id()), result.appliedChangeIds());
        assertEquals(1, result.failures().size());
        assertEquals("COST005", result.failures().get(0).policyCode());
        assertEquals(2, result.newVersion());

        AgentSession after = agent.getSession(session.getId());
        assertEquals(SessionStatus.COMPLETED, after.getStatus());
        assertEquals(ChangeStatus.APPLIED, change(after, "SEC004").status());
        assertEquals(ChangeStatus.ACCEPTED, change(after, "COST005").status());
        assertNotNull(after.getCompletedAt());

        String content = agent.getTemplateContent(TEMPLATE_ID);
        assertTrue(content.contains("encrypted = true"));
        assertTrue(content.contains("type = \"gp2\""));

        List<TemplateVersion> versions = agent.getTemplateVersions(TEMPLATE_ID);
        assertEquals(2, versions.size());
        assertEquals(VOLUME, versions.get(0).content());
        assertEquals(AgentService.BASELINE_CHANGE_LOG, versions.get(0).changeLog());
        assertEquals(VersionAuthor.AGENT, versions.get(1).createdBy());
        assertEquals(content, versions.get(1).content());
        assertEquals("Agent applied 1 changes: SEC004", versions.get(1).changeLog());
    }

    @Test
    void applyChanges_ShouldMarkUnacceptedChangesRejected() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        agent.applyChanges(session.getId(), List.of(change(session, "COST005").id()));

        AgentSession after = agent.getSession(session.getId());
        assertEquals(ChangeStatus.REJECTED, change(after, "SEC004").status());
        assertEquals(ChangeStatus.APPLIED, change(after, "COST005").status());
        assertTrue(agent.getTemplateContent(TEMPLATE_ID).contains("type = \"gp3\""));
    }

    @Test
    void applyChanges_ShouldReturnToReviewWhenNothingApplies() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        ApplyResult result = agent.applyChanges(session.getId(), List.of("unknown-change"));

        assertEquals(SessionStatus.REVIEWING, result.status());
        assertEquals(0, result.appliedCount());
        assertNull(result.newVersion());
        assertEquals(SessionStatus.REVIEWING, agent.getSession(session.getId()).getStatus());
        assertNotNull(agent.getSession(session.getId()).getErrorMessage());
        assertTrue(templateStore.listVersions(TEMPLATE_ID).isEmpty());
        assertEquals(VOLUME, agent.getTemplateContent(TEMPLATE_ID));
    }

    @Test
    void applyChanges_ShouldLetOnlyOneConcurrentApplyWin() throws Exception {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");
        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ApplyResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                futures.add(callers.submit(() -> {
                    start.await();
                    return agent.applyChanges(session.getId(), ids(session));
                }));
            }
            start.countDown();

            int completed = 0;
            int conflicts = 0;
            for (Future<ApplyResult> future : futures) {
                try {
                    if (future.get(10, TimeUnit.SECONDS).status() == SessionStatus.COMPLETED) {
                        completed++;
                    }
                } catch (java.util.concurrent.ExecutionException e) {
                    assertInstanceOf(SessionStateConflictException.class, e.getCause());
                    conflicts++;
                }
            }

            assertEquals(1, completed);
            assertEquals(1, conflicts);
            assertEquals(2, templateStore.listVersions(TEMPLATE_ID).size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void applyChanges_ShouldGateSessionsOfSameTemplate() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryTemplateStore slowStore = new InMemoryTemplateStore() {
            @Override
            public TemplateVersion createBaselineIfAbsent(String templateId, String content, String changeLog,
                                                          VersionAuthor createdBy) {
                writing.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.createBaselineIfAbsent(templateId, content, changeLog, createdBy);
            }
        };
        AgentService gated = new AgentService(engine, remediation, slowStore, sessionRepository,
                new TfGuardProperties());
        gated.saveTemplate(TEMPLATE_ID, VOLUME);
        AgentSession first = gated.analyzeAndPlan(TEMPLATE_ID, "aws");
        AgentSession second = gated.analyzeAndPlan(TEMPLATE_ID, "aws");

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<ApplyResult> winner = caller.submit(() -> gated.applyChanges(first.getId(), ids(first)));
            assertTrue(writing.await(10, TimeUnit.SECONDS));

            assertThrows(SessionStateConflictException.class,
                    () -> gated.applyChanges(second.getId(), ids(second)));
            assertEquals(SessionStatus.REVIEWING, gated.getSession(second.getId()).getStatus());

            release.countDown();
            ApplyResult result = winner.get(10, TimeUnit.SECONDS);
            assertEquals(SessionStatus.COMPLETED, result.status());
            assertEquals(2, result.newVersion());
            assertEquals(List.of(1, 2),
                    slowStore.listVersions(TEMPLATE_ID).stream().map(TemplateVersion::version).toList());
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void applyChanges_ShouldRejectSessionThatIsNotReviewing() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");
        agent.applyChanges(session.getId(), ids(session));

        assertThrows(SessionStateConflictException.class,
                () -> agent.applyChanges(session.getId(), ids(session)));
    }

    @Test
    void applyChanges_ShouldFailForUnknownSession() {
        assertThrows(NotFoundException.class, () -> agent.applyChanges("nope", Collections.emptyList()));
    }

    @Test
    void cancelSession_ShouldOnlyCancelReviewingSessions() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        AgentSession cancelled = agent.cancelSession(session.getId());

        assertEquals(SessionStatus.CANCELLED, cancelled.getStatus());
        assertNotNull(cancelled.getCompletedAt());
        assertThrows(SessionStateConflictException.class, () -> agent.cancelSession(session.getId()));
        assertThrows(SessionStateConflictException.class, () -> agent.applyChanges(session.getId(), ids(session)));
    }

    @Test
    void listSessions_ShouldReturnNewestFirst() throws InterruptedException {
        AgentSession first = agent.analyzeAndPlan(TEMPLATE_ID, "aws");
        Thread.sleep(5);
        AgentSession second = agent.analyzeAndPlan(TEMPLATE_ID, "aws");

        List<AgentSession> sessions = agent.listSessions(TEMPLATE_ID);

        assertEquals(List.of(second.getId(), first.getId()), sessions.stream().map(AgentSession::getId).toList());
    }

    @Test
    void restoreTemplateVersion_ShouldAppendSnapshotAndRestoredVersion() {
        AgentSession session = agent.analyzeAndPlan(TEMPLATE_ID, "aws");
        agent.applyChanges(session.getId(), ids(session));
        String applied = agent.getTemplateContent(TEMPLATE_ID);

        TemplateVersion restored = agent.restoreTemplateVersion(TEMPLATE_ID, 1);

        assertEquals(4, restored.version());
        assertEquals(VOLUME, agent.getTemplateContent(TEMPLATE_ID));
        List<TemplateVersion> versions = agent.getTemplateVersions(TEMPLATE_ID);
        assertEquals(List.of(1, 2, 3, 4), versions.stream().map(TemplateVersion::version).toList());
        assertEquals(applied, versions.get(2).content());
        assertEquals("Restored from version 1", versions.get(3).changeLog());
    }

    @Test
    void restoreTemplateVersion_ShouldRejectUnknownVersion() {
        assertThrows(NotFoundException.class, () -> agent.restoreTemplateVersion(TEMPLATE_ID, 7));
    }

    @Test
    void saveTemplate_ShouldRejectNullContent() {
        assertThrows(ParseFailureException.class, () -> agent.saveTemplate(TEMPLATE_ID, null));
        assertThrows(NotFoundException.class, () -> agent.getTemplateVersions("missing"));
    }
}
