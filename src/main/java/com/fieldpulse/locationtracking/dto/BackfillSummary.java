package com.fieldpulse.locationtracking.dto;

import lombok.*;

/**
 * Counters for one address backfill run.
 *
 * processed  : points handed to the run
 * successful : points that now carry an address
 * failed     : points whose group failed to resolve
 * skipped    : points left untouched (already addressed, near-duplicates
 *              outside a group, or groups cut off by the circuit breaker)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackfillSummary {

    private String message;
    private int processed;
    private int successful;
    private int failed;
    private int skipped;
    private int groupsTotal;
    private int groupsResolved;
    private int groupsFailed;
    private int groupsSkipped;
    private boolean circuitOpen;

    public static BackfillSummary empty(String message, int processed) {
        return BackfillSummary.builder().message(message).processed(processed).skipped(processed).build();
    }

}
