package com.wafsentinel.engine.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Recent run statuses, newest first, bounded to a fixed capacity. Every
 * recorded run is also written to the log as a {@code RUN_RECORD} line.
 *
 * @author WAF Sentinel Team
 */
public class RunHistory {

    private static final Logger log = LoggerFactory.getLogger(RunHistory.class);

    private final int capacity;
    private final Deque<RunStatus> runs = new ArrayDeque<>();

    public RunHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Run history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void record(RunStatus status) {
        runs.addFirst(status);
        while (runs.size() > capacity) {
            runs.removeLast();
        }
        log.info("RUN_RECORD: id={} kind={} outcome={} fetched={} classified={} duplicates={} skipped={} "
                + "started={} finished={} message={}",
                status.runId(), status.kind(), status.outcome(), status.fetched(), status.classified(),
                status.duplicates(), status.skipped(), status.startedAt(), status.finishedAt(), status.message());
    }

    public synchronized List<RunStatus> recent() {
        return new ArrayList<>(runs);
    }

    public synchronized Optional<RunStatus> latest(RunKind kind) {
        return runs.stream().filter(r -> r.kind() == kind).findFirst();
    }
}
