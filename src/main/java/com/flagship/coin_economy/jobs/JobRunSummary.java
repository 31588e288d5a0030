package com.flagship.coin_economy.jobs;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one run of a batch job.
 *
 * candidates = processed + failed + skipped + deferred. Skipped items were taken
 * by a concurrent run or were no longer pending; deferred ones are left for the
 * next run (transient failure or run deadline reached).
 */
@Value
@Builder
public class JobRunSummary {
    String jobName;
    int candidates;
    int processed;
    int failed;
    int skipped;
    int deferred;
    long totalAmount;
    int notificationFailures;
    long durationMs;
}
