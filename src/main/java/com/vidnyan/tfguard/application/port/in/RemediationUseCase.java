package com.vidnyan.tfguard.application.port.in;

import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import com.vidnyan.tfguard.domain.remediation.Remediation;

import java.util.List;

/**
 * Turn violations into validated text edits.
 */
public interface RemediationUseCase {

    /**
     * Build a fix for one violation. Never fails: the weakest outcome is a
     * manual placeholder.
     */
    Remediation generateFix(String content, PolicyViolations group, PolicyResult violation);

    /**
     * Build fixes for every auto-fixable violation of an audit, in audit order.
     */
    List<Remediation> generateBatchFixes(String content, AuditResult audit);

    FixValidation validateFix(String content, FixDiff diff);

    String applyFix(String content, FixDiff diff);
}
