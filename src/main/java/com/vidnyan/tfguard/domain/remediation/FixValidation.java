package com.vidnyan.tfguard.domain.remediation;

/**
 * Outcome of checking a fix against the current content. When valid,
 * {@code resultContent} holds the patched text.
 */
public record FixValidation(boolean valid, String error, String resultContent) {

    public static FixValidation valid(String resultContent) {
        return new FixValidation(true, null, resultContent);
    }

    public static FixValidation invalid(String error) {
        return new FixValidation(false, error, null);
    }
}
