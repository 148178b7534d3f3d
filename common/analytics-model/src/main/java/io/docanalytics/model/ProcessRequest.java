package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Dispatcher to worker request. {@code filepath} is accepted as a legacy alias for {@code item}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessRequest(String action, @JsonAlias("filepath") String item) {

    public static final String ACTION_PROCESS = "process";

    public static ProcessRequest process(String item) {
        return new ProcessRequest(ACTION_PROCESS, item);
    }

    public boolean isProcess() {
        return ACTION_PROCESS.equals(action);
    }
}
