package io.docanalytics.dispatcher.results;

import io.docanalytics.model.InvalidInputException;
import io.docanalytics.model.TopicBroadcast;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topics whose aggregators the collector polls.
 */
public class AggregatorDirectory {

    private static final Logger log = LoggerFactory.getLogger(AggregatorDirectory.class);

    private final Set<String> topics = new ConcurrentSkipListSet<>();

    public AggregatorDirectory(Collection<String> initialTopics) {
        if (initialTopics != null) {
            initialTopics.forEach(this::register);
        }
    }

    /**
     * @return {@code true} when the topic was not known yet
     * @throws InvalidInputException when the topic could not be used as a routing key
     */
    public boolean register(String topic) {
        String valid;
        try {
            valid = TopicBroadcast.requireValidTopic(topic == null ? null : topic.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage());
        }
        boolean added = topics.add(valid);
        if (added) {
            log.info("[COLLECT] aggregator registered topic={}", valid);
        }
        return added;
    }

    public List<String> all() {
        return List.copyOf(topics);
    }
}
