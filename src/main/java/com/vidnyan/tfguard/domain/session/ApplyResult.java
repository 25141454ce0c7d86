package com.vidnyan.tfguard.domain.session;

import java.util.List;

/**
 * Outcome of applying accepted changes. {@code newVersion} is null when
 * nothing was applied.
 */
public record ApplyResult(
    String sessionId,
    SessionStatus status,
    int appliedCount,
    List<String> appliedChangeIds,
    List<ChangeOutcome> outcomes,
    Integer newVersion
) {

    public ApplyResult {
        appliedChangeIds = List.copyOf(appliedChangeIds);
        outcomes = List.copyOf(outcomes);
    }

    public List<ChangeOutcome> failures() {
        return outcomes.stream().filter(o -> !o.applied()).toList();
    }
}
