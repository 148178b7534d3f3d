package io.docanalytics.dispatcher.config;

import io.docanalytics.model.WorkerDescriptor;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Dispatcher settings.
 *
 * @param callTimeout upper bound on one worker call
 * @param workers     workers registered at startup, in addition to those registered over REST
 */
@Validated
@ConfigurationProperties("docanalytics.dispatcher")
public record DispatcherProperties(@NotNull Duration callTimeout, List<WorkerDescriptor> workers) {

    public DispatcherProperties {
        workers = workers == null ? List.of() : List.copyOf(workers);
    }
}
