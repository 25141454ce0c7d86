package com.vidnyan.tfguard.domain.delta;

import com.vidnyan.tfguard.domain.audit.PolicyViolations;

import java.util.List;

/**
 * Violation changes between two audits, matched by policy code and resource.
 */
public record SecurityDelta(
    List<PolicyViolations> newViolations,
    List<PolicyViolations> fixedViolations,
    int totalIssuesChange,
    int scoreChange
) {

    public SecurityDelta {
        newViolations = List.copyOf(newViolations);
        fixedViolations = List.copyOf(fixedViolations);
    }

    public int newCount() {
        return newViolations.stream().mapToInt(v -> v.results().size()).sum();
    }

    public int fixedCount() {
        return fixedViolations.stream().mapToInt(v -> v.results().size()).sum();
    }
}
