package com.wafsentinel.engine.alert;

import com.wafsentinel.engine.hardening.RuleSetDiff;
import com.wafsentinel.engine.hardening.RuleTransition;
import com.wafsentinel.engine.trend.AggregationWindow;
import com.wafsentinel.engine.trend.TrafficSummary;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Transport-neutral notification payload.
 *
 * @param eventId   unique id
 * @param kind      event kind
 * @param severity  severity
 * @param subject   one-line summary
 * @param body      plain-text detail
 * @param details   structured fields for indexing
 * @param timestamp when the event was raised
 *
 * @author WAF Sentinel Team
 */
public record NotificationEvent(
        String eventId,
        NotificationKind kind,
        NotificationSeverity severity,
        String subject,
        String body,
        Map<String, Object> details,
        Instant timestamp) {

    public NotificationEvent {
        details = Map.copyOf(details);
    }

    public static NotificationEvent classifierError(String runId, String message, Instant at) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("run_id", runId);
        details.put("error", String.valueOf(message));
        return create(NotificationKind.CLASSIFIER_ERROR,
                "Classification run " + runId + " aborted",
                "The classification run " + runId + " was aborted:\n\n" + message
                        + "\n\nThe cursor stays at the last committed record; the next run resumes from there.",
                details, at);
    }

    public static NotificationEvent ruleSetChanged(RuleSetDiff diff, Instant at) {
        StringBuilder body = new StringBuilder();
        body.append("Rule set moved from version ").append(diff.baseVersion())
                .append(" to ").append(diff.resultingVersion())
                .append(" in cycle ").append(diff.cycleId()).append(".\n\n");
        for (RuleTransition t : diff.transitions()) {
            body.append(String.format(Locale.ROOT, "  rule %s (PL%d): %s -> %s, triggers=%d, malicious=%d, precision=%s%n",
                    t.ruleId(), t.stat().paranoiaLevel(), t.from(), t.to(), t.stat().triggerCount(),
                    t.stat().maliciousCount(), t.stat().precision() == null
                            ? "n/a" : String.format(Locale.ROOT, "%.3f", t.stat().precision())));
        }
        body.append("\nRoll back with POST /api/rules/rollback/").append(diff.cycleId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cycle_id", diff.cycleId());
        details.put("base_version", diff.baseVersion());
        details.put("resulting_version", diff.resultingVersion());
        details.put("transitions", diff.transitions().stream()
                .map(t -> t.ruleId() + ":" + t.from() + "->" + t.to()).toList());
        return create(NotificationKind.RULE_SET_CHANGED,
                "Rule set changed to version " + diff.resultingVersion(), body.toString(), details, at);
    }

    public static NotificationEvent severityThresholdExceeded(TrafficSummary summary, AggregationWindow window,
            double threshold, Instant at) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("window_from", window.from().toString());
        details.put("window_to", window.to().toString());
        details.put("total_records", summary.totalRecords());
        details.put("attack_percentage", summary.attackPercentage());
        details.put("normal_percentage", summary.normalPercentage());
        details.put("average_anomaly_score", summary.averageAnomalyScore());
        details.put("threshold", threshold);
        return create(NotificationKind.SEVERITY_THRESHOLD_EXCEEDED,
                "Attack traffic at " + summary.attackPercentage() + "%",
                String.format(Locale.ROOT, "Attack traffic detected between %s and %s.%n%n"
                        + "Total records: %d%nAttack percentage: %.2f%% (threshold %.2f%%)%n"
                        + "Normal percentage: %.2f%%%nAverage anomaly score: %.2f%n",
                        window.from(), window.to(), summary.totalRecords(), summary.attackPercentage(), threshold,
                        summary.normalPercentage(), summary.averageAnomalyScore()),
                details, at);
    }

    public static NotificationEvent hardeningFailed(String cycleId, String message, Instant at) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cycle_id", cycleId);
        details.put("error", String.valueOf(message));
        return create(NotificationKind.HARDENING_FAILED,
                "Hardening cycle " + cycleId + " failed",
                "The hardening cycle " + cycleId + " could not persist its rule set:\n\n" + message
                        + "\n\nThe previous rule set is still in force. The change is not retried automatically.",
                details, at);
    }

    private static NotificationEvent create(NotificationKind kind, String subject, String body,
            Map<String, Object> details, Instant at) {
        return new NotificationEvent(UUID.randomUUID().toString(), kind, kind.getDefaultSeverity(),
                subject, body, details, at);
    }
}
