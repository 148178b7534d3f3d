package io.docanalytics.dispatcher.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.docanalytics.model.DistributionOutcome;
import io.docanalytics.model.TopicMetrics;
import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import java.util.Map;

/**
 * Request and response bodies of the dispatcher control surface.
 */
public final class DispatcherApi {

    static final String SUCCESS = "success";
    static final String ERROR = "error";

    private DispatcherApi() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentsRequest(List<String> documents) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkerRegistrationRequest(WorkerDescriptor worker) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AggregatorRegistrationRequest(String topic) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Ack(String status, Integer registered, Integer removed) {

        static Ack ok() {
            return new Ack(SUCCESS, null, null);
        }

        static Ack registered(int count) {
            return new Ack(SUCCESS, count, null);
        }

        static Ack removed(int count) {
            return new Ack(SUCCESS, null, count);
        }
    }

    public record DistributionResponse(String status, int processed, int errors, int unassigned, List<String> topics) {

        static DistributionResponse from(DistributionOutcome outcome) {
            return new DistributionResponse("completed", outcome.processedCount(), outcome.errorCount(),
                outcome.unassignedCount(), outcome.topics());
        }
    }

    public record ResultsResponse(String status, Map<String, TopicMetrics> results) {
    }

    public record ErrorResponse(String status, String error, String message) {

        static ErrorResponse of(String error, String message) {
            return new ErrorResponse(ERROR, error, message);
        }
    }
}
