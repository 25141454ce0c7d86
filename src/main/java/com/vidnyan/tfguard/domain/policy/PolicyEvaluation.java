package com.vidnyan.tfguard.domain.policy;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one policy against one configuration.
 */
public record PolicyEvaluation(
    PolicyDefinition policy,
    List<PolicyResult> results,
    Duration executionTime,
    EvaluationStatus status,
    String errorMessage
) {

    public enum EvaluationStatus {
        SUCCESS,
        ERROR
    }

    public static PolicyEvaluation success(PolicyDefinition policy, List<PolicyResult> results, Duration duration) {
        return new PolicyEvaluation(policy, List.copyOf(results), duration, EvaluationStatus.SUCCESS, null);
    }

    /**
     * A policy that threw. It contributes no results.
     */
    public static PolicyEvaluation error(PolicyDefinition policy, String errorMessage) {
        return new PolicyEvaluation(policy, List.of(), Duration.ZERO, EvaluationStatus.ERROR, errorMessage);
    }

    public boolean isSuccess() {
        return status == EvaluationStatus.SUCCESS;
    }

    public boolean passed() {
        return isSuccess() && results.isEmpty();
    }
}
