package com.vidnyan.tfguard.domain.audit;

/**
 * Violation counts and the resulting security score.
 */
public record AuditSummary(
    int totalIssues,
    int critical,
    int high,
    int medium,
    int low,
    int info,
    int passedChecks,
    int score
) {

    /**
     * {@code clamp(100 - 25*critical - 15*high - 5*medium - 2*low, 0, 100)}.
     */
    public static int score(int critical, int high, int medium, int low) {
        int raw = 100 - 25 * critical - 15 * high - 5 * medium - 2 * low;
        return Math.max(0, Math.min(100, raw));
    }
}
