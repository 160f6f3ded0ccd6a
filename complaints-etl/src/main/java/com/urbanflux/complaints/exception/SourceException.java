package com.urbanflux.complaints.exception;

/**
 * The source stream, or a row of it, could not be read.
 */
public class SourceException extends EtlException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
