package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.adapter.out.parser.HclConfigParser;
import com.vidnyan.tfguard.adapter.out.persistence.InMemoryAuditReportRepository;
import com.vidnyan.tfguard.adapter.out.policy.BuiltInPolicyRepository;
import com.vidnyan.tfguard.adapter.out.policy.InMemoryPolicyActivation;
import com.vidnyan.tfguard.adapter.out.pricing.AwsPricingService;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.model.LiveResource;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEngineServiceTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final InMemoryAuditReportRepository reports = new InMemoryAuditReportRepository();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PolicyEngineService engine(BuiltInPolicyRepository repository) {
        return new PolicyEngineService(new HclConfigParser(), repository,
                new CostAnalysisService(new AwsPricingService()), reports, executor, new TfGuardProperties());
    }

    private PolicyEngineService builtInEngine() {
        return engine(new BuiltInPolicyRepository(new InMemoryPolicyActivation(List.of())));
    }

    @Test
    void audit_ShouldReportUnprotectedBucketAsSingleCritical() {
        AuditResult result = builtInEngine().audit("t1", """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """, "aws");

        assertEquals(1, result.summary().critical());
        List<PolicyResult> sec001 = result.resultsOf("SEC001");
        assertEquals(1, sec001.size());
        assertEquals("aws_s3_bucket.name", sec001.get(0).resourceRef());
        assertTrue(sec001.get(0).autoFixable());
        assertEquals(PolicyDefinition.Severity.CRITICAL, result.violations().get(0).severity());
        assertEquals(1, result.resourceCount());
        assertEquals(0.5, result.costBreakdown().totalMonthly(), 0.001);
    }

    @Test
    void audit_ShouldScoreFromSeverityCounts() {
        AuditResult result = builtInEngine().audit("t1", """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """, "aws");

        int expected = 100 - 25 * result.summary().critical() - 15 * result.summary().high()
                - 5 * result.summary().medium() - 2 * result.summary().low();
        assertEquals(Math.max(0, expected), result.score());
        assertTrue(result.score() >= 0 && result.score() <= 100);
    }

    @Test
    void audit_ShouldNotRaiseScoreWhenViolationsAreAdded() {
        PolicyEngineService engine = builtInEngine();
        String bucket = """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """;
        String withVolume = bucket + """
                resource "aws_ebs_volume" "data" {
                  size = 10
                }
                """;

        assertTrue(engine.audit(null, withVolume, "aws").score() <= engine.audit(null, bucket, "aws").score());
    }

    @Test
    void audit_ShouldIsolateThrowingPolicy() {
        PolicyDefinition boom = PolicyDefinition.builder()
                .code("BOOM")
                .name("Always fails")
                .provider("aws")
                .check(ctx -> {
                    throw new IllegalStateException("kaboom");
                })
                .build();
        PolicyDefinition quiet = PolicyDefinition.builder()
                .code("QUIET")
                .name("Never fires")
                .provider("aws")
                .check(ctx -> List.of())
                .build();
        BuiltInPolicyRepository repository = new BuiltInPolicyRepository(List.of(boom, quiet),
                new InMemoryPolicyActivation(List.of()));

        AuditResult result = engine(repository).audit(null, "resource \"aws_vpc\" \"main\" {}\n", "aws");

        assertEquals(1, result.policyFailures().size());
        assertEquals("BOOM", result.policyFailures().get(0).policyCode());
        assertEquals("kaboom", result.policyFailures().get(0).error());
        assertEquals(1, result.summary().passedChecks());
        assertEquals(100, result.score());
    }

    @Test
    void audit_ShouldSkipDisabledPolicies() {
        BuiltInPolicyRepository repository = new BuiltInPolicyRepository(new InMemoryPolicyActivation(List.of("SEC001")));

        AuditResult result = engine(repository).audit(null, """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """, "aws");

        assertTrue(result.findGroup("SEC001").isEmpty());
        assertEquals(0, result.summary().critical());
    }

    @Test
    void audit_ShouldDefaultProviderWhenNotGiven() {
        AuditResult result = builtInEngine().audit(null, """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """, null);

        assertEquals("aws", result.provider());
        assertFalse(result.resultsOf("SEC001").isEmpty());
    }

    @Test
    void audit_ShouldMarkUnpriceableResourceWithoutFailing() {
        AuditResult result = builtInEngine().audit(null, """
                resource "aws_instance" "web" {
                  instance_type = var.instance_type
                  metadata_options {
                    http_tokens = "required"
                  }
                }
                """, "aws");

        assertFalse(result.costBreakdown().resources().get(0).estimated());
        assertEquals(0.0, result.costBreakdown().totalMonthly());
    }

    @Test
    void audit_ShouldOrderGroupsBySeverity() {
        AuditResult result = builtInEngine().audit(null, """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                resource "aws_ebs_volume" "data" {
                  size = 100
                  type = "gp2"
                }
                """, "aws");

        List<PolicyDefinition.Severity> severities = result.violations().stream()
                .map(PolicyViolations::severity)
                .toList();
        for (int i = 1; i < severities.size(); i++) {
            assertTrue(severities.get(i - 1).compareTo(severities.get(i)) <= 0);
        }
    }

    @Test
    void auditLiveResources_ShouldEvaluateInventoryLikeTemplates() {
        LiveResource volume = new LiveResource("vol-1", "data", "aws_ebs_volume", "us-east-1",
                Map.of("size", 100L, "type", "gp2", "encrypted", false));

        AuditResult result = builtInEngine().auditLiveResources(List.of(volume), "aws", null);

        assertEquals("aws_ebs_volume.data", result.resultsOf("SEC004").get(0).resourceRef());
        assertEquals(1, result.resultsOf("COST005").size());
        assertEquals(10.0, result.costBreakdown().totalMonthly(), 0.001);
    }

    @Test
    void auditLiveResources_ShouldKeepCollidingNamesApart() {
        Map<String, Object> gp2 = Map.of("size", 100L, "type", "gp2", "encrypted", true);
        List<LiveResource> inventory = List.of(
                new LiveResource("vol-1", "data", "aws_ebs_volume", null, gp2),
                new LiveResource("vol-2", "data", "aws_ebs_volume", null, gp2),
                new LiveResource(null, "data", "aws_ebs_volume", null, gp2));

        AuditResult result = builtInEngine().auditLiveResources(inventory, "aws", null);

        assertEquals(List.of("aws_ebs_volume.data", "aws_ebs_volume.vol-2", "aws_ebs_volume.data_2"),
                result.resultsOf("COST005").stream().map(PolicyResult::resourceRef).toList());
        assertEquals(3, result.violationKeys().stream().filter(k -> k.policyCode().equals("COST005")).count());
        assertEquals(30.0, result.costBreakdown().totalMonthly(), 0.001);
    }

    @Test
    void auditLiveResources_ShouldRejectItemWithoutType() {
        LiveResource untyped = new LiveResource("i-1", "web", null, null, Map.of());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builtInEngine().auditLiveResources(List.of(untyped), "aws", null));
        assertTrue(e.getMessage().contains("i-1"));
    }

    @Test
    void audit_ShouldStoreReportOnlyForNamedTemplates() {
        PolicyEngineService engine = builtInEngine();
        String bucket = """
                resource "aws_s3_bucket" "name" {
                  bucket = "my-bucket"
                }
                """;

        engine.audit(bucket, "aws");
        assertThrows(NotFoundException.class, () -> engine.getLatestReport("t1"));

        engine.audit("t1", bucket, "aws");
        AuditResult latest = engine.audit("t1", """
                resource "aws_cloudtrail" "main" {
                  enable_log_file_validation = true
                }
                """, "aws");

        assertSame(latest, engine.getLatestReport("t1"));
        assertEquals(0, engine.getLatestReport("t1").summary().totalIssues());
        List<AuditResult> history = engine.listReports("t1");
        assertEquals(2, history.size());
        assertEquals(1, history.get(1).summary().critical());
        assertEquals(List.of("aws_s3_bucket.name"),
                history.get(1).resultsOf("SEC001").stream().map(PolicyResult::resourceRef).toList());
    }
}
