package com.wafsentinel.engine.orchestration;

import java.time.Instant;

/**
 * Bookkeeping of one classification run, hardening cycle or rollback.
 *
 * @param runId      run id (for hardening, the cycle id used in the journal)
 * @param kind       run kind
 * @param startedAt  start time
 * @param finishedAt end time
 * @param outcome    terminal outcome
 * @param fetched    records read from the store; for hardening, classified records aggregated
 * @param classified records classified and written as new documents
 * @param duplicates records whose classification already existed
 * @param skipped    records skipped because they could not be classified or stored
 * @param message    human readable summary or error
 *
 * @author WAF Sentinel Team
 */
public record RunStatus(
        String runId,
        RunKind kind,
        Instant startedAt,
        Instant finishedAt,
        RunOutcome outcome,
        long fetched,
        long classified,
        long duplicates,
        long skipped,
        String message) {

    public static RunStatus skipped(String runId, RunKind kind, Instant at, String message) {
        return new RunStatus(runId, kind, at, at, RunOutcome.SKIPPED, 0, 0, 0, 0, message);
    }
}
