package com.urbanflux.complaints.service;

import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;

/**
 * Unique keys seen so far in one run. First sighting of a key passes, every later one is a duplicate.
 */
@Slf4j
public class Deduplicator {

    private final Set<Long> seenKeys = new HashSet<>();

    /** Records the key and reports whether it had been seen before. */
    public boolean isDuplicate(long uniqueKey) {
        return !seenKeys.add(uniqueKey);
    }

    public int uniqueCount() {
        return seenKeys.size();
    }

    public void clear() {
        seenKeys.clear();
        log.debug("Deduplicator cleared");
    }
}
