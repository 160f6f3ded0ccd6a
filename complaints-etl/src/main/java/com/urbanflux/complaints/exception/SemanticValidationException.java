package com.urbanflux.complaints.exception;

/**
 * A field decoded fine but breaks a domain rule, e.g. an empty complaint type
 * or a closed date before the created date.
 */
public class SemanticValidationException extends EtlException {

    public SemanticValidationException(String message) {
        super(message);
    }
}
