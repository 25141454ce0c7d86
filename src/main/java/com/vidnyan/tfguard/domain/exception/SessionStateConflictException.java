package com.vidnyan.tfguard.domain.exception;

import com.vidnyan.tfguard.domain.session.SessionStatus;

/**
 * A session transition was requested from the wrong state, or lost a race
 * against a concurrent request.
 */
public class SessionStateConflictException extends TfGuardException {

    public SessionStateConflictException(String message) {
        super("SESSION_STATE_CONFLICT", message);
    }

    public static SessionStateConflictException expected(String sessionId, SessionStatus expected, SessionStatus actual) {
        return new SessionStateConflictException(
                "Session " + sessionId + " is " + actual + ", expected " + expected);
    }
}
