package com.vidnyan.tfguard.domain.delta;

/**
 * Textual and semantic difference between two configuration versions.
 */
public record DiffResult(
    String patch,
    double costDelta,
    SecurityDelta securityDelta,
    double oldMonthlyCost,
    double newMonthlyCost,
    int oldScore,
    int newScore
) {
}
