package com.vidnyan.tfguard.domain.exception;

/**
 * The original content could not be read at all.
 */
public class ParseFailureException extends TfGuardException {

    public ParseFailureException(String message) {
        super("PARSE_FAILURE", message);
    }
}
