package com.vidnyan.tfguard.domain.audit;

import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.policy.ViolationKey;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of auditing one configuration.
 */
public record AuditResult(
    String templateId,
    String provider,
    List<PolicyViolations> violations,
    AuditSummary summary,
    CostBreakdown costBreakdown,
    List<PolicyFailure> policyFailures,
    int resourceCount,
    Instant timestamp
) {

    public AuditResult {
        violations = List.copyOf(violations);
        policyFailures = List.copyOf(policyFailures);
    }

    public int score() {
        return summary.score();
    }

    public Set<ViolationKey> violationKeys() {
        Set<ViolationKey> keys = new LinkedHashSet<>();
        for (PolicyViolations group : violations) {
            group.results().forEach(r -> keys.add(group.keyOf(r)));
        }
        return keys;
    }

    public Optional<PolicyViolations> findGroup(String policyCode) {
        return violations.stream()
                .filter(v -> v.policyCode().equals(policyCode))
                .findFirst();
    }

    public List<PolicyResult> resultsOf(String policyCode) {
        return findGroup(policyCode).map(PolicyViolations::results).orElse(List.of());
    }
}
