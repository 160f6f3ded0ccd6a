package com.urbanflux.complaints.exception;

/**
 * The database rejected a write or query. Always fatal to the current run.
 */
public class StoreException extends EtlException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
