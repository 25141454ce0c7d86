package com.vidnyan.tfguard.domain.exception;

public class NotFoundException extends TfGuardException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static NotFoundException of(String kind, Object id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
