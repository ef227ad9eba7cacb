package com.wafsentinel.engine.orchestration;

/**
 * Terminal outcome of a run.
 *
 * @author WAF Sentinel Team
 */
public enum RunOutcome {
    /** Completed. */
    SUCCEEDED,
    /** Stopped on an error that the next scheduled run may not hit again. */
    ABORTED,
    /** Stopped on an error that needs operator attention. */
    FAILED,
    /** Not started because a run of the same kind was in progress. */
    SKIPPED,
    /** Stopped on request between two records. */
    CANCELLED
}
