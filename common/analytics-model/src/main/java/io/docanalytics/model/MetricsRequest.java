package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricsRequest(String action) {

    public static final String ACTION_GET_METRICS = "get_metrics";

    public static MetricsRequest getMetrics() {
        return new MetricsRequest(ACTION_GET_METRICS);
    }

    public boolean isGetMetrics() {
        return ACTION_GET_METRICS.equals(action);
    }
}
