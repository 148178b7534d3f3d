package io.docanalytics.dispatcher.results;

import io.docanalytics.model.TopicMetrics;
import io.docanalytics.transport.AggregatorMetricsClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls every known aggregator once and merges the snapshots that came back. Aggregators that
 * fail or stay silent are left out of the result.
 */
public class ResultCollector {

    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private final AggregatorDirectory directory;
    private final AggregatorMetricsClient metricsClient;

    public ResultCollector(AggregatorDirectory directory, AggregatorMetricsClient metricsClient) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.metricsClient = Objects.requireNonNull(metricsClient, "metricsClient");
    }

    public Map<String, TopicMetrics> collect() {
        Map<String, TopicMetrics> results = new LinkedHashMap<>();
        for (String topic : directory.all()) {
            Optional<TopicMetrics> metrics = metricsClient.fetch(topic);
            metrics.ifPresent(m -> results.put(topic, m));
        }
        log.info("[COLLECT] collected {} of {} aggregators", results.size(), directory.all().size());
        return results;
    }
}
