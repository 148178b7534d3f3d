package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricsResponse(String status, TopicMetrics metrics, String message) {

    public static MetricsResponse success(TopicMetrics metrics) {
        return new MetricsResponse(ProcessResponse.STATUS_SUCCESS, metrics, null);
    }

    public static MetricsResponse error(String message) {
        return new MetricsResponse(ProcessResponse.STATUS_ERROR, null, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return ProcessResponse.STATUS_SUCCESS.equals(status) && metrics != null;
    }
}
