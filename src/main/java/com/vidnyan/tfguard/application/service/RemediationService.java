package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.application.port.in.RemediationUseCase;
import com.vidnyan.tfguard.application.port.out.ConfigParser;
import com.vidnyan.tfguard.application.port.out.FixSuggester;
import com.vidnyan.tfguard.application.port.out.PatchStrategy;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import com.vidnyan.tfguard.config.TfGuardConfiguration;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.model.ParsedConfig;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixImpact;
import com.vidnyan.tfguard.domain.remediation.FixSource;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import com.vidnyan.tfguard.domain.remediation.Remediation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Remediation planner. Static templates first, then the AI suggester, then a
 * manual placeholder.
 */
@Slf4j
@Service
public class RemediationService implements RemediationUseCase {

    static final String PLACEHOLDER_PREFIX = "# MANUAL FIX REQUIRED";

    private final ConfigParser configParser;
    private final PatchStrategy patchStrategy;
    private final FixSuggester fixSuggester;
    private final PolicyRepository policyRepository;
    private final ExecutorService aiExecutor;
    private final Duration aiTimeout;

    public RemediationService(ConfigParser configParser,
                              PatchStrategy patchStrategy,
                              FixSuggester fixSuggester,
                              PolicyRepository policyRepository,
                              @Qualifier(TfGuardConfiguration.AI_EXECUTOR) ExecutorService aiExecutor,
                              TfGuardProperties properties) {
        this.configParser = configParser;
        this.patchStrategy = patchStrategy;
        this.fixSuggester = fixSuggester;
        this.policyRepository = policyRepository;
        this.aiExecutor = aiExecutor;
        this.aiTimeout = properties.getRemediation().getAiTimeout();
    }

    @Override
    public Remediation generateFix(String content, PolicyViolations group, PolicyResult violation) {
        String code = group.policyCode();
        Remediation.Builder builder = Remediation.builder()
                .id(newId(code))
                .policyCode(code)
                .title("Fix: " + group.policyName())
                .severity(group.severity())
                .category(group.category())
                .resourceRef(violation.resourceRef())
                .impact(estimateImpact(group, violation));

        FixDiff staticFix = staticFix(content, code, violation);
        if (staticFix != null) {
            log.debug("Static fix for {} on {}", code, violation.resourceRef());
            return builder
                    .diff(staticFix)
                    .description(violation.suggestion() != null
                            ? violation.suggestion()
                            : "Apply automated fix for " + group.policyName())
                    .source(FixSource.STATIC_TEMPLATE)
                    .build();
        }

        FixSuggester.Suggestion suggestion = suggest(content, group, violation);
        if (suggestion != null) {
            return builder
                    .diff(new FixDiff(suggestion.before(), suggestion.after()))
                    .description(suggestion.description() != null && !suggestion.description().isBlank()
                            ? suggestion.description()
                            : "AI-generated fix for " + group.policyName())
                    .source(FixSource.AI_SUGGESTION)
                    .build();
        }

        String hint = violation.suggestion() != null ? violation.suggestion() : violation.message();
        return builder
                .diff(FixDiff.append(PLACEHOLDER_PREFIX + " (" + code + "): " + hint))
                .description(violation.suggestion() != null
                        ? violation.suggestion()
                        : "Manual fix required for " + group.policyName())
                .source(FixSource.MANUAL_PLACEHOLDER)
                .build();
    }

    @Override
    public List<Remediation> generateBatchFixes(String content, AuditResult audit) {
        List<Remediation> remediations = new ArrayList<>();
        for (PolicyViolations group : audit.violations()) {
            for (PolicyResult result : group.results()) {
                if (!result.autoFixable()) {
                    continue;
                }
                try {
                    remediations.add(generateFix(content, group, result));
                } catch (RuntimeException e) {
                    log.error("Failed to generate fix for {} on {}: {}",
                            group.policyCode(), result.resourceRef(), e.getMessage());
                }
            }
        }
        log.info("Generated {} fixes for audit of {}", remediations.size(), audit.templateId());
        return remediations;
    }

    @Override
    public FixValidation validateFix(String content, FixDiff diff) {
        return patchStrategy.validate(content, diff);
    }

    @Override
    public String applyFix(String content, FixDiff diff) {
        return patchStrategy.apply(content, diff);
    }

    private FixDiff staticFix(String content, String code, PolicyResult violation) {
        return StaticFixTemplates.forPolicy(code)
                .map(template -> {
                    ParsedConfig parsed = configParser.parse(content);
                    return template.apply(violation, parsed);
                })
                .orElse(null);
    }

    /**
     * Ask the suggester within the configured timeout. Null on any failure or
     * unusable answer.
     */
    private FixSuggester.Suggestion suggest(String content, PolicyViolations group, PolicyResult violation) {
        if (!fixSuggester.isAvailable()) {
            return null;
        }
        String description = policyRepository.findByCode(group.policyCode())
                .map(PolicyDefinition::description)
                .orElse("");
        FixSuggester.FixRequest request = new FixSuggester.FixRequest(
                group.policyCode(), group.policyName(), description,
                violation.resourceRef(), violation.resourceType(),
                violation.message(), violation.suggestion());

        CompletableFuture<FixSuggester.Suggestion> future =
                CompletableFuture.supplyAsync(() -> fixSuggester.suggestFix(content, request), aiExecutor);
        try {
            FixSuggester.Suggestion suggestion = future.get(aiTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (suggestion == null || suggestion.after() == null || suggestion.after().isBlank()) {
                log.warn("AI fix for {} was empty, falling back to manual placeholder", group.policyCode());
                return null;
            }
            return suggestion;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("AI fix for {} timed out after {}", group.policyCode(), aiTimeout);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return null;
        } catch (ExecutionException e) {
            log.warn("AI fix generation failed for {}: {}", group.policyCode(), e.getCause().getMessage());
            return null;
        }
    }

    static FixImpact estimateImpact(PolicyViolations group, PolicyResult violation) {
        return switch (group.category()) {
            case SECURITY -> new FixImpact(group.severity().scoreWeight(), 0.0);
            case COST -> {
                double savings = violation.metadataNumber("estimatedSavings");
                if (savings == 0.0) {
                    savings = violation.metadataNumber("monthlySavings");
                }
                yield new FixImpact(0, -savings);
            }
            default -> FixImpact.NONE;
        };
    }

    private static String newId(String code) {
        return "fix-" + code + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
