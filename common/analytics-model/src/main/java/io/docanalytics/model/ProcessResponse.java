package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Worker reply: {@code {status: "success", topics: [...]}} or
 * {@code {status: "error", message: "..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessResponse(String status,
                              List<String> topics,
                              Integer topicsFound,
                              String item,
                              String message) {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public ProcessResponse {
        topics = topics == null ? null : List.copyOf(topics);
    }

    public static ProcessResponse success(String item, List<String> topics) {
        List<String> found = topics == null ? List.of() : topics;
        return new ProcessResponse(STATUS_SUCCESS, found, found.size(), item, null);
    }

    public static ProcessResponse error(String message) {
        return new ProcessResponse(STATUS_ERROR, null, null, null, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    @JsonIgnore
    public List<String> topicsOrEmpty() {
        return topics == null ? List.of() : topics;
    }
}
