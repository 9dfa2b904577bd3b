package com.aera.client.offline.application;

import java.util.List;

import com.aera.client.offline.domain.SyncOutcome;
import com.aera.client.offline.domain.SyncResult;

/**
 * Summary of one sync pass. {@code started} is false when the pass was skipped.
 */
public record SyncReport(boolean started, List<SyncOutcome> outcomes, int remaining) {

    public SyncReport {
        outcomes = List.copyOf(outcomes);
    }

    public static SyncReport notStarted(int remaining) {
        return new SyncReport(false, List.of(), remaining);
    }

    public long count(SyncResult result) {
        return outcomes.stream().filter(outcome -> outcome.result() == result).count();
    }
}
