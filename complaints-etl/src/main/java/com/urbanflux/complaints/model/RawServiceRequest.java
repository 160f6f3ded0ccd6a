package com.urbanflux.complaints.model;

import lombok.Builder;
import lombok.Data;

/**
 * Raw CSV row, text only, exactly as it came off the source. Mapped by header name, so column order
 * in the file does not matter.
 */
@Data
@Builder
public class RawServiceRequest {

    /** 1-based data line number (header excluded) */
    private long lineNumber;

    private String uniqueKey;
    private String createdDate;
    private String closedDate;
    private String complaintType;
    private String descriptor;
    private String borough;
    private String latitude;
    private String longitude;
}
