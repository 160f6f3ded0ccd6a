package com.urbanflux.complaints.exception;

/**
 * A field could not be decoded into its expected type (integer key, timestamp).
 */
public class FieldFormatException extends EtlException {

    public FieldFormatException(String message) {
        super(message);
    }

    public FieldFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
