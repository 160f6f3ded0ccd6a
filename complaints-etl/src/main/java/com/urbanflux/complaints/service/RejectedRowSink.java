package com.urbanflux.complaints.service;

/**
 * Receives rows that were dropped by the reader or by Transform, with the reason.
 */
@FunctionalInterface
public interface RejectedRowSink {

    RejectedRowSink NONE = (stage, lineNumber, fields, reason) -> { };

    enum Stage { PARSE, VALIDATION }

    /**
     * @param lineNumber 1-based data line, 0 when the row is no longer tied to a line
     * @param fields     raw or re-rendered field values, never null
     */
    void reject(Stage stage, long lineNumber, String[] fields, String reason);
}
