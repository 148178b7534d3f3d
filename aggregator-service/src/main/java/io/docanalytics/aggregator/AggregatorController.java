package io.docanalytics.aggregator;

import io.docanalytics.model.TopicMetrics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping(value = "/api/topics", produces = MediaType.APPLICATION_JSON_VALUE)
public class AggregatorController {

    private static final Logger log = LoggerFactory.getLogger(AggregatorController.class);

    private final TopicAggregatorRegistry registry;

    public AggregatorController(TopicAggregatorRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<String> topics() {
        return registry.topics();
    }

    @GetMapping("/{topic}/metrics")
    public TopicMetrics metrics(@PathVariable("topic") String topic) {
        log.info("[REST] GET /api/topics/{}/metrics", topic);
        TopicMetrics metrics = registry.find(topic)
            .map(TopicAggregator::getMetrics)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown topic " + topic));
        log.info("[REST] GET /api/topics/{}/metrics -> docs={}", topic, metrics.docCount());
        return metrics;
    }
}
