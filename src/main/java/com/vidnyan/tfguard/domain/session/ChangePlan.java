package com.vidnyan.tfguard.domain.session;

import com.vidnyan.tfguard.domain.remediation.FixSource;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered list of proposed changes. Order is proposal order and is the order
 * in which accepted changes are applied.
 */
public record ChangePlan(List<AgentChange> changes) {

    public ChangePlan {
        changes = List.copyOf(changes);
    }

    public static ChangePlan empty() {
        return new ChangePlan(List.of());
    }

    public long placeholderCount() {
        return changes.stream().filter(c -> c.source() == FixSource.MANUAL_PLACEHOLDER).count();
    }

    public ChangePlan map(UnaryOperator<AgentChange> mapper) {
        return new ChangePlan(changes.stream().map(mapper).toList());
    }
}
