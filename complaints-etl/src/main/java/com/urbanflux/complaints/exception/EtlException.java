package com.urbanflux.complaints.exception;

/**
 * Base type for every failure raised by the pipeline.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
