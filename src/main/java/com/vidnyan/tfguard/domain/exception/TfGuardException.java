package com.vidnyan.tfguard.domain.exception;

import lombok.Getter;

/**
 * Base class for failures surfaced to callers. Degraded paths (a failing
 * policy, price lookup or fix suggestion) never throw.
 */
@Getter
public class TfGuardException extends RuntimeException {

    private final String code;

    public TfGuardException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TfGuardException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
