package com.vidnyan.tfguard.domain.session;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;

public enum ChangeType {
    SECURITY_FIX,
    COST_OPTIMIZATION,
    BEST_PRACTICE;

    public static ChangeType of(PolicyDefinition.Category category) {
        if (category == null) {
            return BEST_PRACTICE;
        }
        return switch (category) {
            case SECURITY -> SECURITY_FIX;
            case COST -> COST_OPTIMIZATION;
            default -> BEST_PRACTICE;
        };
    }
}
