package com.vidnyan.tfguard.domain.remediation;

/**
 * Expected effect of a fix. A negative cost change is a saving.
 */
public record FixImpact(int securityScoreChange, double monthlyCostChange) {

    public static final FixImpact NONE = new FixImpact(0, 0.0);
}
