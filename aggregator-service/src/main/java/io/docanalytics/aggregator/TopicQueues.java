package io.docanalytics.aggregator;

import java.util.List;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.core.Base64UrlNamingStrategy;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;

/**
 * The two queues serving one topic aggregator: broadcast content and {@code get_metrics}
 * requests. Both are exclusive and auto-delete, so nothing is buffered for an aggregator that
 * is not running.
 */
public record TopicQueues(String topic, Queue contentQueue, Queue metricsQueue) {

    private static final Base64UrlNamingStrategy CONTENT_NAMES =
        new Base64UrlNamingStrategy("docanalytics.aggregator.content.");
    private static final Base64UrlNamingStrategy METRICS_NAMES =
        new Base64UrlNamingStrategy("docanalytics.aggregator.metrics.");

    public static TopicQueues forTopic(String topic) {
        return new TopicQueues(topic, new AnonymousQueue(CONTENT_NAMES), new AnonymousQueue(METRICS_NAMES));
    }

    /**
     * Queues plus their exact-match bindings, routing key = topic.
     */
    public List<Declarable> declarables(DirectExchange broadcastExchange, DirectExchange metricsExchange) {
        Binding content = BindingBuilder.bind(contentQueue).to(broadcastExchange).with(topic);
        Binding metrics = BindingBuilder.bind(metricsQueue).to(metricsExchange).with(topic);
        return List.of(contentQueue, metricsQueue, content, metrics);
    }
}
