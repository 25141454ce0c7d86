package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.out.AuditReportRepository;
import com.vidnyan.tfguard.application.port.out.ConfigParser;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import com.vidnyan.tfguard.config.TfGuardConfiguration;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.AuditSummary;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.audit.PolicyFailure;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.model.LiveResource;
import com.vidnyan.tfguard.domain.model.ParsedConfig;
import com.vidnyan.tfguard.domain.model.ResourceRecord;
import com.vidnyan.tfguard.domain.policy.PolicyContext;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyEvaluation;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Audit engine. Runs every active policy against a parsed configuration,
 * scores the findings and prices the resources.
 */
@Slf4j
@Service
public class PolicyEngineService implements AuditUseCase {

    private final ConfigParser configParser;
    private final PolicyRepository policyRepository;
    private final CostAnalysisService costAnalysisService;
    private final AuditReportRepository reportRepository;
    private final ExecutorService policyExecutor;
    private final TfGuardProperties properties;

    public PolicyEngineService(ConfigParser configParser,
                               PolicyRepository policyRepository,
                               CostAnalysisService costAnalysisService,
                               AuditReportRepository reportRepository,
                               @Qualifier(TfGuardConfiguration.POLICY_EXECUTOR) ExecutorService policyExecutor,
                               TfGuardProperties properties) {
        this.configParser = configParser;
        this.policyRepository = policyRepository;
        this.costAnalysisService = costAnalysisService;
        this.reportRepository = reportRepository;
        this.policyExecutor = policyExecutor;
        this.properties = properties;
    }

    @Override
    public AuditResult audit(String templateId, String content, String requestedProvider) {
        Instant startTime = Instant.now();
        String provider = providerOrDefault(requestedProvider);
        ParsedConfig parsed = configParser.parse(content);
        log.info("Auditing {} ({} resources, provider {})",
                templateId != null ? templateId : "inline content", parsed.resources().size(), provider);

        String region = properties.getAudit().getDefaultRegion();
        List<PolicyEvaluation> evaluations = evaluateAll(PolicyContext.of(parsed, provider));
        CostBreakdown cost = costAnalysisService.analyzeTemplateCost(parsed.resources(), region);

        AuditResult result = assemble(templateId, provider, evaluations, cost, parsed.resources().size());
        log.info("Audit complete: {} issues, score {}, ${}/month in {}ms",
                result.summary().totalIssues(), result.score(), cost.totalMonthly(),
                Duration.between(startTime, Instant.now()).toMillis());
        if (templateId != null) {
            reportRepository.save(result);
        }
        return result;
    }

    @Override
    public AuditResult getLatestReport(String templateId) {
        return reportRepository.findLatest(templateId)
                .orElseThrow(() -> NotFoundException.of("Audit report", templateId));
    }

    @Override
    public List<AuditResult> listReports(String templateId) {
        return reportRepository.findByTemplateId(templateId);
    }

    @Override
    public AuditResult auditLiveResources(List<LiveResource> resources, String requestedProvider, String requestedRegion) {
        String provider = providerOrDefault(requestedProvider);
        String region = requestedRegion == null || requestedRegion.isBlank()
                ? properties.getAudit().getDefaultRegion()
                : requestedRegion;
        log.info("Auditing {} live resources in {}", resources.size(), region);
        List<ResourceRecord> records = LiveResource.toRecords(resources);
        ParsedConfig parsed = ParsedConfig.ofResources(records);
        List<PolicyEvaluation> evaluations = evaluateAll(PolicyContext.of(parsed, provider));
        CostBreakdown cost = costAnalysisService.analyzeLiveResources(resources, region);
        return assemble(null, provider, evaluations, cost, resources.size());
    }

    private String providerOrDefault(String provider) {
        return provider == null || provider.isBlank() ? properties.getAudit().getProvider() : provider;
    }

    /**
     * Fan out one task per active policy and join them in registry order.
     */
    List<PolicyEvaluation> evaluateAll(PolicyContext context) {
        List<PolicyDefinition> policies = policyRepository.getActive(context.provider());
        log.debug("Evaluating {} active policies", policies.size());

        List<CompletableFuture<PolicyEvaluation>> futures = policies.stream()
                .map(policy -> CompletableFuture.supplyAsync(() -> evaluate(policy, context), policyExecutor))
                .toList();

        List<PolicyEvaluation> evaluations = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            PolicyDefinition policy = policies.get(i);
            evaluations.add(futures.get(i)
                    .exceptionally(e -> PolicyEvaluation.error(policy, e.getMessage()))
                    .join());
        }
        return evaluations;
    }

    private PolicyEvaluation evaluate(PolicyDefinition policy, PolicyContext context) {
        Instant start = Instant.now();
        try {
            List<PolicyResult> found = policy.check().check(context);
            List<PolicyResult> results = found == null ? List.of() : found;
            if (!results.isEmpty()) {
                log.debug("  {} found {} violations", policy.code(), results.size());
            }
            return PolicyEvaluation.success(policy, results,
                    Duration.between(start, Instant.now()));
        } catch (Exception e) {
            log.error("Error evaluating policy {}: {}", policy.code(), e.getMessage());
            return PolicyEvaluation.error(policy, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private AuditResult assemble(String templateId, String provider, List<PolicyEvaluation> evaluations,
                                 CostBreakdown cost, int resourceCount) {
        List<PolicyViolations> groups = new ArrayList<>();
        List<PolicyFailure> failures = new ArrayList<>();
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        int info = 0;
        int passed = 0;

        for (PolicyEvaluation evaluation : evaluations) {
            if (!evaluation.isSuccess()) {
                failures.add(new PolicyFailure(evaluation.policy().code(), evaluation.errorMessage()));
                continue;
            }
            if (evaluation.passed()) {
                passed++;
                continue;
            }
            int count = evaluation.results().size();
            switch (evaluation.policy().severity()) {
                case CRITICAL -> critical += count;
                case HIGH -> high += count;
                case MEDIUM -> medium += count;
                case LOW -> low += count;
                case INFO -> info += count;
            }
            groups.add(PolicyViolations.of(evaluation.policy(), evaluation.results()));
        }

        groups.sort(Comparator.comparing(PolicyViolations::severity).thenComparing(PolicyViolations::policyCode));
        int total = critical + high + medium + low + info;
        AuditSummary summary = new AuditSummary(total, critical, high, medium, low, info, passed,
                AuditSummary.score(critical, high, medium, low));

        return new AuditResult(templateId, provider, groups, summary, cost, failures, resourceCount, Instant.now());
    }
}
