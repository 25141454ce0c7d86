package com.vidnyan.tfguard.domain.audit;

/**
 * Monthly cost line for a single resource. {@code estimated} is false when the
 * price lookup failed and the cost was recorded as zero.
 */
public record ResourceCost(
    String resourceRef,
    String resourceType,
    String service,
    double monthlyCost,
    String description,
    boolean estimated
) {
}
