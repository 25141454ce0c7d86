package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.adapter.out.parser.HclConfigParser;
import com.vidnyan.tfguard.adapter.out.patch.SubstringPatchStrategy;
import com.vidnyan.tfguard.adapter.out.policy.BuiltInPolicyRepository;
import com.vidnyan.tfguard.adapter.out.policy.InMemoryPolicyActivation;
import com.vidnyan.tfguard.application.port.out.FixSuggester;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.AuditSummary;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Category;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Severity;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixImpact;
import com.vidnyan.tfguard.domain.remediation.FixSource;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import com.vidnyan.tfguard.domain.remediation.Remediation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RemediationServiceTest {

    private static final String BUCKET = """
            resource "aws_s3_bucket" "assets" {
              bucket = "acme-assets"
            }""";

    private static final String VOLUME = """
            resource "aws_ebs_volume" "data" {
              size = 100
              type = "gp2"
            }""";

    private static final String IAM = """
            resource "aws_iam_policy" "admin" {
              policy = data.aws_iam_policy_document.admin.json
            }""";

    private final ExecutorService aiExecutor = Executors.newFixedThreadPool(2);
    private final HclConfigParser parser = new HclConfigParser();

    @AfterEach
    void tearDown() {
        aiExecutor.shutdownNow();
    }

    /**
     * Suggester answering from a supplier, or unavailable when the supplier is null.
     */
    private static FixSuggester suggester(Supplier<FixSuggester.Suggestion> answer) {
        return new FixSuggester() {
            @Override
            public Suggestion suggestFix(String content, FixRequest request) {
                return answer.get();
            }

            @Override
            public boolean isAvailable() {
                return answer != null;
            }
        };
    }

    private RemediationService service(FixSuggester suggester) {
        TfGuardProperties properties = new TfGuardProperties();
        properties.getRemediation().setAiTimeout(Duration.ofMillis(300));
        return new RemediationService(parser, new SubstringPatchStrategy(parser), suggester,
                new BuiltInPolicyRepository(new InMemoryPolicyActivation(List.of())), aiExecutor, properties);
    }

    private static PolicyResult result(String ref, String type, boolean fixable, Map<String, Object> metadata) {
        return PolicyResult.builder()
                .resourceRef(ref)
                .resourceType(type)
                .line(1)
                .message("problem with " + ref)
                .suggestion("fix " + ref)
                .autoFixable(fixable)
                .metadata(metadata)
                .build();
    }

    private static PolicyViolations group(String code, Category category, Severity severity, PolicyResult... results) {
        return new PolicyViolations(code, "Policy " + code, category, severity, List.of(results));
    }

    @Test
    void generateFix_ShouldAppendPublicAccessBlockForBucket() {
        PolicyResult violation = result("aws_s3_bucket.assets", "aws_s3_bucket", true, Map.of());

        Remediation fix = service(suggester(null))
                .generateFix(BUCKET, group("SEC001", Category.SECURITY, Severity.CRITICAL, violation), violation);

        assertEquals(FixSource.STATIC_TEMPLATE, fix.source());
        assertTrue(fix.diff().isAppend());
        assertTrue(fix.diff().after().contains("resource \"aws_s3_bucket_public_access_block\" \"assets_public_access\""));
        assertTrue(fix.diff().after().contains("bucket = aws_s3_bucket.assets.id"));
        assertTrue(fix.id().startsWith("fix-SEC001-"));
        assertEquals("Fix: Policy SEC001", fix.title());
        assertEquals(new FixImpact(25, 0.0), fix.impact());
    }

    @Test
    void generateFix_ShouldProduceFixThatClearsTheViolation() {
        PolicyResult violation = result("aws_s3_bucket.assets", "aws_s3_bucket", true, Map.of());
        RemediationService service = service(suggester(null));

        Remediation fix = service.generateFix(BUCKET, group("SEC001", Category.SECURITY, Severity.CRITICAL, violation), violation);
        FixValidation validation = service.validateFix(BUCKET, fix.diff());

        assertTrue(validation.valid());
        assertEquals(2, parser.parse(validation.resultContent()).resources().size());
    }

    @Test
    void generateFix_ShouldRewriteVolumeTypeWithSavingsImpact() {
        PolicyResult violation = result("aws_ebs_volume.data", "aws_ebs_volume", true,
                Map.of("estimatedSavings", 2.0));

        Remediation fix = service(suggester(null))
                .generateFix(VOLUME, group("COST005", Category.COST, Severity.INFO, violation), violation);

        assertEquals(VOLUME, fix.diff().before());
        assertTrue(fix.diff().after().contains("type = \"gp3\""));
        assertEquals(-2.0, fix.impact().monthlyCostChange(), 0.001);
        assertEquals(0, fix.impact().securityScoreChange());
    }

    @Test
    void generateFix_ShouldUseAiSuggestionWhenNoTemplateExists() {
        PolicyResult violation = result("aws_iam_policy.admin", "aws_iam_policy", false, Map.of());
        FixSuggester.Suggestion answer = new FixSuggester.Suggestion(
                "data.aws_iam_policy_document.admin.json", "data.aws_iam_policy_document.read_only.json", "Narrow the action");

        Remediation fix = service(suggester(() -> answer))
                .generateFix(IAM, group("SEC005", Category.SECURITY, Severity.HIGH, violation), violation);

        assertEquals(FixSource.AI_SUGGESTION, fix.source());
        assertEquals("Narrow the action", fix.description());
        assertEquals(answer.after(), fix.diff().after());
    }

    @Test
    void generateFix_ShouldFallBackToPlaceholderWhenAiFails() {
        PolicyResult violation = result("aws_iam_policy.admin", "aws_iam_policy", false, Map.of());

        Remediation fix = service(suggester(() -> {
            throw new IllegalStateException("rate limited");
        })).generateFix(IAM, group("SEC005", Category.SECURITY, Severity.HIGH, violation), violation);

        assertEquals(FixSource.MANUAL_PLACEHOLDER, fix.source());
        assertTrue(fix.isPlaceholder());
        assertEquals("# MANUAL FIX REQUIRED (SEC005): fix aws_iam_policy.admin", fix.diff().after());
    }

    @Test
    void generateFix_ShouldFallBackToPlaceholderWhenAiTimesOut() {
        PolicyResult violation = result("aws_iam_policy.admin", "aws_iam_policy", false, Map.of());

        Remediation fix = service(suggester(() -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new FixSuggester.Suggestion("a", "b", "late");
        })).generateFix(IAM, group("SEC005", Category.SECURITY, Severity.HIGH, violation), violation);

        assertEquals(FixSource.MANUAL_PLACEHOLDER, fix.source());
    }

    @Test
    void generateFix_ShouldFallBackToPlaceholderWhenAiAnswerIsBlank() {
        PolicyResult violation = result("aws_iam_policy.admin", "aws_iam_policy", false, Map.of());

        Remediation fix = service(suggester(() -> new FixSuggester.Suggestion("x", " ", "nothing")))
                .generateFix(IAM, group("SEC005", Category.SECURITY, Severity.HIGH, violation), violation);

        assertEquals(FixSource.MANUAL_PLACEHOLDER, fix.source());
    }

    @Test
    void generateFix_ShouldNotUseTemplateWhenResourceIsMissing() {
        PolicyResult violation = result("aws_db_instance.gone", "aws_db_instance", true, Map.of());

        Remediation fix = service(suggester(null))
                .generateFix(VOLUME, group("SEC003", Category.SECURITY, Severity.HIGH, violation), violation);

        assertEquals(FixSource.MANUAL_PLACEHOLDER, fix.source());
        assertTrue(fix.diff().isAppend());
    }

    @Test
    void generateBatchFixes_ShouldOnlyCoverAutoFixableViolationsInOrder() {
        PolicyResult bucket = result("aws_s3_bucket.assets", "aws_s3_bucket", true, Map.of());
        PolicyResult trail = result(PolicyResult.TEMPLATE_REF, "aws_cloudtrail", false, Map.of());
        PolicyResult volume = result("aws_ebs_volume.data", "aws_ebs_volume", true, Map.of("estimatedSavings", 2.0));
        AuditResult audit = new AuditResult("t1", "aws",
                List.of(group("SEC001", Category.SECURITY, Severity.CRITICAL, bucket),
                        group("SEC006", Category.SECURITY, Severity.HIGH, trail),
                        group("COST005", Category.COST, Severity.INFO, volume)),
                new AuditSummary(3, 1, 1, 0, 0, 1, 0, 60),
                CostBreakdown.empty("us-east-1"), List.of(), 2, Instant.now());

        List<Remediation> fixes = service(suggester(null)).generateBatchFixes(BUCKET + "\n\n" + VOLUME, audit);

        assertEquals(List.of("SEC001", "COST005"), fixes.stream().map(Remediation::policyCode).toList());
        assertTrue(fixes.stream().allMatch(f -> f.source() == FixSource.STATIC_TEMPLATE));
    }

    @Test
    void estimateImpact_ShouldFallBackToMonthlySavings() {
        PolicyResult violation = result("aws_db_instance.dev", "aws_db_instance", true, Map.of("monthlySavings", 12.5));

        FixImpact impact = RemediationService.estimateImpact(
                group("COST003", Category.COST, Severity.MEDIUM, violation), violation);

        assertEquals(-12.5, impact.monthlyCostChange(), 0.001);
    }

    @Test
    void applyFix_ShouldDelegateToPatchStrategy() {
        RemediationService service = service(suggester(null));

        String patched = service.applyFix(VOLUME, new FixDiff("gp2", "gp3"));

        assertTrue(patched.contains("gp3"));
    }
}
