package com.vidnyan.tfguard.application.port.out;

/**
 * Port for text-generated fix suggestions.
 * Implemented by LLM adapters.
 */
public interface FixSuggester {

    /**
     * Ask for a before/after edit that resolves the violation.
     * Implementations throw on transport errors or unusable answers.
     */
    Suggestion suggestFix(String content, FixRequest request);

    /**
     * Whether a backend is configured at all.
     */
    boolean isAvailable();

    /**
     * The violation to fix.
     */
    record FixRequest(
        String policyCode,
        String policyName,
        String policyDescription,
        String resourceRef,
        String resourceType,
        String message,
        String suggestion
    ) {}

    /**
     * Suggested edit.
     */
    record Suggestion(
        String before,
        String after,
        String description
    ) {}
}
