package com.skyshield.evaluator.loop;

/**
 * What happened during one evaluation cycle.
 *
 * @param fetched         LIVE tracks returned by the store
 * @param evaluated       tracks that were scored
 * @param dataErrors      tracks skipped because their record was malformed
 * @param scoresWritten   score writes that updated a row
 * @param scoresSuppressed scores held back by the dead-band
 * @param escalations     tracks moved from LIVE to ENGAGED
 * @param persistFailures failed writes, including a failed commit
 * @param skipped         true if the fetch failed and nothing was evaluated
 * @param committed       true if the cycle's writes were committed
 */
public record CycleReport(
    int fetched,
    int evaluated,
    int dataErrors,
    int scoresWritten,
    int scoresSuppressed,
    int escalations,
    int persistFailures,
    boolean skipped,
    boolean committed
) {

    static CycleReport skippedCycle() {
        return new CycleReport(0, 0, 0, 0, 0, 0, 0, true, false);
    }
}
