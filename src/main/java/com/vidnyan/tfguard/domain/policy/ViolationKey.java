package com.vidnyan.tfguard.domain.policy;

/**
 * Stable identity of a violation across two audits.
 */
public record ViolationKey(String policyCode, String resourceRef) {

    @Override
    public String toString() {
        return policyCode + ":" + resourceRef;
    }
}
