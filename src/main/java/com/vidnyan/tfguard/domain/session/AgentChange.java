package com.vidnyan.tfguard.domain.session;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.remediation.ChangeStatus;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixImpact;
import com.vidnyan.tfguard.domain.remediation.FixSource;
import com.vidnyan.tfguard.domain.remediation.Remediation;

/**
 * One proposed edit inside a change plan.
 */
public record AgentChange(
    String id,
    ChangeType type,
    String policyCode,
    String title,
    String description,
    PolicyDefinition.Severity severity,
    String resourceRef,
    FixDiff diff,
    FixImpact impact,
    FixSource source,
    ChangeStatus status
) {

    public static AgentChange from(Remediation remediation) {
        return new AgentChange(
                remediation.id(),
                ChangeType.of(remediation.category()),
                remediation.policyCode(),
                remediation.title(),
                remediation.description(),
                remediation.severity(),
                remediation.resourceRef(),
                remediation.diff(),
                remediation.impact(),
                remediation.source(),
                ChangeStatus.PROPOSED);
    }

    public AgentChange withStatus(ChangeStatus newStatus) {
        return new AgentChange(id, type, policyCode, title, description, severity,
                resourceRef, diff, impact, source, newStatus);
    }
}
