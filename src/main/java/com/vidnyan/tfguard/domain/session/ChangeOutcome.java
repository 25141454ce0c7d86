package com.vidnyan.tfguard.domain.session;

/**
 * What happened to one accepted change during apply.
 */
public record ChangeOutcome(String changeId, String policyCode, boolean applied, String error) {

    public static ChangeOutcome applied(AgentChange change) {
        return new ChangeOutcome(change.id(), change.policyCode(), true, null);
    }

    public static ChangeOutcome failed(AgentChange change, String error) {
        return new ChangeOutcome(change.id(), change.policyCode(), false, error);
    }
}
