package io.docanalytics.dispatcher.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Result collection settings.
 *
 * @param timeout how long to wait for each aggregator's snapshot
 * @param topics  aggregators known at startup
 */
@Validated
@ConfigurationProperties("docanalytics.collector")
public record CollectorProperties(@NotNull Duration timeout, List<@NotBlank String> topics) {

    public CollectorProperties {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
