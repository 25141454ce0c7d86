package com.vidnyan.tfguard.domain.session;

/**
 * Lifecycle of an agent session.
 * <pre>
 * PLANNING  -> REVIEWING | CANCELLED
 * REVIEWING -> APPLYING  | CANCELLED
 * APPLYING  -> COMPLETED | REVIEWING
 * </pre>
 */
public enum SessionStatus {
    PLANNING,
    REVIEWING,
    APPLYING,
    COMPLETED,
    CANCELLED
}
