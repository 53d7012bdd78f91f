package com.company.silencing.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Aggregate counts over stored silences, statuses derived from the time window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceStats {
    private long total;
    private long pending;
    private long active;
    private long expired;

    // Top creators by silence count
    private Map<String, Long> byCreator;
}
