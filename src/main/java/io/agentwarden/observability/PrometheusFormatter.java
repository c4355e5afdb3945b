package io.agentwarden.observability;

import io.agentwarden.model.MetricSummary;
import io.agentwarden.model.WorkerState;
import io.agentwarden.model.WorkerStatusSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders supervisor and queue state in the Prometheus text exposition format.
 */
public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(
            List<WorkerStatusSnapshot> workers,
            Map<String, Integer> messageStats,
            List<MetricSummary> metricSummaries
    ) {
        StringBuilder sb = new StringBuilder();

        Map<String, Integer> byState = new LinkedHashMap<>();
        for (WorkerState state : WorkerState.values()) {
            byState.put(state.name().toLowerCase(), 0);
        }
        for (WorkerStatusSnapshot w : workers) {
            byState.merge(w.state().name().toLowerCase(), 1, Integer::sum);
        }
        appendMapGauge(sb, "agentwarden_workers_by_state", "Supervised workers by state", "state", byState);

        for (WorkerStatusSnapshot w : workers) {
            appendGauge(sb, "agentwarden_worker_restarts_total", "Restarts performed for a role",
                    "role", w.role(), w.restartCount());
        }
        for (WorkerStatusSnapshot w : workers) {
            if (w.heartbeatAgeMs() != null) {
                appendGauge(sb, "agentwarden_heartbeat_age_ms", "Age of the latest heartbeat",
                        "role", w.role(), w.heartbeatAgeMs());
            }
        }
        for (WorkerStatusSnapshot w : workers) {
            appendGauge(sb, "agentwarden_worker_uptime_ms", "Uptime of the current worker process",
                    "role", w.role(), w.uptimeMs());
        }

        Map<String, Integer> statuses = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : messageStats.entrySet()) {
            statuses.put(e.getKey().toLowerCase(), e.getValue());
        }
        appendMapGauge(sb, "agentwarden_messages_total", "Queued messages by status", "status", statuses);

        for (MetricSummary m : metricSummaries) {
            appendLabelled(sb, "agentwarden_operation_count", "Recorded worker operations", operationLabels(m), m.count());
        }
        for (MetricSummary m : metricSummaries) {
            appendLabelled(sb, "agentwarden_operation_max_duration_ms", "Slowest recorded operation",
                    operationLabels(m), m.maxDurationMs());
        }
        return sb.toString();
    }

    private static String operationLabels(MetricSummary m) {
        return "role=\"" + escapeLabel(m.role()) + "\",operation=\"" + escapeLabel(m.operationType()) + "\"";
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendLabelled(StringBuilder sb, String metric, String help, String labels, long value) {
        appendHeader(sb, metric, help);
        sb.append(metric).append('{').append(labels).append("} ").append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
