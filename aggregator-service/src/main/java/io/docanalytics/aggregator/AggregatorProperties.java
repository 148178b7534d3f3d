package io.docanalytics.aggregator;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param topics topics this process aggregates, one aggregator each
 */
@Validated
@ConfigurationProperties("docanalytics.aggregator")
public record AggregatorProperties(@NotEmpty List<@NotBlank String> topics) {
}
