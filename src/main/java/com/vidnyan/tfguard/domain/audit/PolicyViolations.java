package com.vidnyan.tfguard.domain.audit;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.policy.ViolationKey;

import java.util.List;

/**
 * All findings of one policy in one audit.
 */
public record PolicyViolations(
    String policyCode,
    String policyName,
    PolicyDefinition.Category category,
    PolicyDefinition.Severity severity,
    List<PolicyResult> results
) {

    public PolicyViolations {
        results = List.copyOf(results);
    }

    public static PolicyViolations of(PolicyDefinition policy, List<PolicyResult> results) {
        return new PolicyViolations(policy.code(), policy.name(), policy.category(), policy.severity(), results);
    }

    public ViolationKey keyOf(PolicyResult result) {
        return new ViolationKey(policyCode, result.resourceRef());
    }

    /**
     * Copy of this group holding only the given results.
     */
    public PolicyViolations withResults(List<PolicyResult> subset) {
        return new PolicyViolations(policyCode, policyName, category, severity, subset);
    }
}
