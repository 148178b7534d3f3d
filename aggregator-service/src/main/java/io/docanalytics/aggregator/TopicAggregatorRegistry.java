package io.docanalytics.aggregator;

import io.docanalytics.model.TopicBroadcast;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The aggregators of this process, keyed by topic. Fixed at startup.
 */
public class TopicAggregatorRegistry {

    private final Map<String, TopicAggregator> aggregators;
    private final List<String> topics;

    public TopicAggregatorRegistry(Collection<String> topics) {
        Map<String, TopicAggregator> byTopic = new LinkedHashMap<>();
        for (String topic : topics) {
            String valid = TopicBroadcast.requireValidTopic(topic.strip());
            byTopic.putIfAbsent(valid, new TopicAggregator(valid));
        }
        this.aggregators = Map.copyOf(byTopic);
        this.topics = List.copyOf(byTopic.keySet());
    }

    public Optional<TopicAggregator> find(String topic) {
        return Optional.ofNullable(topic).map(aggregators::get);
    }

    public List<String> topics() {
        return topics;
    }

    public List<TopicAggregator> all() {
        return topics.stream().map(aggregators::get).toList();
    }
}
