package io.docanalytics.aggregator;

import io.docanalytics.model.TopicBroadcast;
import io.docanalytics.model.TopicMetrics;
import io.docanalytics.transport.TopicBroadcastCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageListener;

/**
 * Feeds broadcasts for one topic into its aggregator. Broadcasts for any other topic are dropped.
 */
public class TopicContentListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(TopicContentListener.class);

    private final TopicAggregator aggregator;
    private final Counter documents;
    private final Counter ignored;

    public TopicContentListener(TopicAggregator aggregator, MeterRegistry registry) {
        this.aggregator = aggregator;
        this.documents = documents(registry, aggregator.topic(), "aggregated");
        this.ignored = documents(registry, aggregator.topic(), "ignored");
    }

    @Override
    public void onMessage(Message message) {
        TopicBroadcast broadcast;
        try {
            broadcast = TopicBroadcastCodec.decode(message);
        } catch (IllegalArgumentException e) {
            ignored.increment();
            log.warn("[AGG] dropping broadcast without usable topic: {}", e.getMessage());
            return;
        }
        if (!aggregator.topic().equals(broadcast.topic())) {
            ignored.increment();
            log.debug("[AGG] ignoring broadcast for topic={} on aggregator={}", broadcast.topic(), aggregator.topic());
            return;
        }
        String previous = MDC.get("topic");
        MDC.put("topic", aggregator.topic());
        try {
            TopicMetrics totals = aggregator.processContent(broadcast.content());
            documents.increment();
            log.debug("[AGG] topic={} docs={} lines={} words={} chars={}",
                totals.topic(), totals.docCount(), totals.lineCount(), totals.wordCount(), totals.charCount());
        } finally {
            if (previous == null) {
                MDC.remove("topic");
            } else {
                MDC.put("topic", previous);
            }
        }
    }

    private static Counter documents(MeterRegistry registry, String topic, String outcome) {
        return Counter.builder("docanalytics.aggregator.documents")
            .description("Topic broadcasts received by an aggregator")
            .tag("topic", topic)
            .tag("outcome", outcome)
            .register(registry);
    }
}
