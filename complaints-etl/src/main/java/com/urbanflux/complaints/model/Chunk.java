package com.urbanflux.complaints.model;

import lombok.Value;

import java.util.List;

/**
 * An ordered, bounded group of parsed records plus the counters that produced it.
 */
@Value
public class Chunk {

    List<ServiceRequest> records;
    EtlStats stats;

    public Chunk(List<ServiceRequest> records, EtlStats stats) {
        this.records = List.copyOf(records);
        this.stats = stats;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
