package com.urbanflux.complaints.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Deduplicator Tests")
class DeduplicatorTest {

    @Test
    @DisplayName("Should pass the first sighting and flag every later one")
    void shouldFlagRepeats() {
        Deduplicator dedup = new Deduplicator();

        assertThat(dedup.isDuplicate(1)).isFalse();
        assertThat(dedup.isDuplicate(2)).isFalse();
        assertThat(dedup.isDuplicate(1)).isTrue();
        assertThat(dedup.isDuplicate(1)).isTrue();
        assertThat(dedup.uniqueCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should start over after clear")
    void shouldClear() {
        Deduplicator dedup = new Deduplicator();
        dedup.isDuplicate(1);

        dedup.clear();

        assertThat(dedup.uniqueCount()).isZero();
        assertThat(dedup.isDuplicate(1)).isFalse();
    }
}
