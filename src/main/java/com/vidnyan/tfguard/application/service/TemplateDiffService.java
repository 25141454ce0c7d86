package com.vidnyan.tfguard.application.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.in.CompareUseCase;
import com.vidnyan.tfguard.config.TfGuardConfiguration;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.delta.DiffResult;
import com.vidnyan.tfguard.domain.delta.SecurityDelta;
import com.vidnyan.tfguard.domain.exception.ParseFailureException;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.policy.ViolationKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Delta engine. Compares two versions of a configuration textually and by
 * violation identity.
 */
@Slf4j
@Service
public class TemplateDiffService implements CompareUseCase {

    static final String OLD_LABEL = "Current Version";
    static final String NEW_LABEL = "New Version";
    static final int CONTEXT_LINES = 3;

    private final AuditUseCase auditUseCase;
    private final ExecutorService auditExecutor;

    public TemplateDiffService(AuditUseCase auditUseCase,
                               @Qualifier(TfGuardConfiguration.AUDIT_EXECUTOR) ExecutorService auditExecutor) {
        this.auditUseCase = auditUseCase;
        this.auditExecutor = auditExecutor;
    }

    @Override
    public DiffResult compare(String oldContent, String newContent, String provider) {
        if (oldContent == null || newContent == null) {
            throw new ParseFailureException("Both versions are required for a comparison");
        }
        CompletableFuture<AuditResult> oldAudit =
                CompletableFuture.supplyAsync(() -> auditUseCase.audit(oldContent, provider), auditExecutor);
        CompletableFuture<AuditResult> newAudit =
                CompletableFuture.supplyAsync(() -> auditUseCase.audit(newContent, provider), auditExecutor);

        String patch = unifiedPatch(oldContent, newContent);

        AuditResult before = join(oldAudit);
        AuditResult after = join(newAudit);

        SecurityDelta securityDelta = new SecurityDelta(
                onlyIn(after, before.violationKeys()),
                onlyIn(before, after.violationKeys()),
                after.summary().totalIssues() - before.summary().totalIssues(),
                after.score() - before.score());

        double oldCost = before.costBreakdown().totalMonthly();
        double newCost = after.costBreakdown().totalMonthly();
        double costDelta = CostBreakdown.round2(newCost - oldCost);

        log.info("Compared versions: {} new, {} fixed, score {} -> {}, cost delta ${}",
                securityDelta.newCount(), securityDelta.fixedCount(), before.score(), after.score(), costDelta);

        return new DiffResult(patch, costDelta, securityDelta, oldCost, newCost, before.score(), after.score());
    }

    /**
     * Unified diff of the two texts, labelled as current and new version.
     */
    static String unifiedPatch(String oldContent, String newContent) {
        List<String> oldLines = oldContent.lines().toList();
        List<String> newLines = newContent.lines().toList();
        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(OLD_LABEL, NEW_LABEL, oldLines, patch, CONTEXT_LINES);
        return String.join("\n", unified);
    }

    /**
     * Violations of {@code audit} whose key is not in {@code otherKeys}, kept
     * in their policy groups.
     */
    static List<PolicyViolations> onlyIn(AuditResult audit, Set<ViolationKey> otherKeys) {
        List<PolicyViolations> groups = new ArrayList<>();
        for (PolicyViolations group : audit.violations()) {
            List<PolicyResult> unmatched = group.results().stream()
                    .filter(r -> !otherKeys.contains(group.keyOf(r)))
                    .toList();
            if (!unmatched.isEmpty()) {
                groups.add(group.withResults(unmatched));
            }
        }
        return groups;
    }

    private static AuditResult join(CompletableFuture<AuditResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
