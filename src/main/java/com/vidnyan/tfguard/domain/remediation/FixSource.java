package com.vidnyan.tfguard.domain.remediation;

/**
 * Where a fix came from, most trusted first.
 */
public enum FixSource {
    STATIC_TEMPLATE,
    AI_SUGGESTION,
    MANUAL_PLACEHOLDER
}
