package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixValidation;

/**
 * Port for applying text edits to configuration content.
 */
public interface PatchStrategy {

    /**
     * Apply the edit without checks.
     */
    String apply(String content, FixDiff diff);

    /**
     * Check that the edit applies and does not lose resources.
     */
    FixValidation validate(String content, FixDiff diff);
}
