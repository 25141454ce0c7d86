package com.vidnyan.tfguard.domain.remediation;

/**
 * Text edit: replace the first occurrence of {@code before} with {@code after},
 * or append {@code after} when {@code before} is empty.
 */
public record FixDiff(String before, String after) {

    public FixDiff {
        before = before == null ? "" : before;
        after = after == null ? "" : after;
    }

    public static FixDiff append(String after) {
        return new FixDiff("", after);
    }

    public boolean isAppend() {
        return before.isEmpty();
    }
}
