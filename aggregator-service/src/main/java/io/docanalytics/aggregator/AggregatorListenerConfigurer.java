package io.docanalytics.aggregator;

import io.docanalytics.transport.JsonMessageCodec;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.rabbit.annotation.RabbitListenerConfigurer;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerEndpoint;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistrar;

/**
 * Registers one single-consumer listener per queue of every topic aggregator, so each aggregator
 * folds its broadcasts in arrival order.
 */
public final class AggregatorListenerConfigurer implements RabbitListenerConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AggregatorListenerConfigurer.class);

    private final TopicAggregatorRegistry registry;
    private final List<TopicQueues> queues;
    private final AmqpTemplate rabbit;
    private final JsonMessageCodec codec;
    private final MeterRegistry meterRegistry;

    public AggregatorListenerConfigurer(TopicAggregatorRegistry registry,
                                        AmqpTemplate rabbit,
                                        JsonMessageCodec codec,
                                        MeterRegistry meterRegistry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.queues = registry.topics().stream().map(TopicQueues::forTopic).toList();
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /**
     * Queues and bindings to declare for every aggregator of this process.
     */
    public List<Declarable> declarables(DirectExchange broadcastExchange, DirectExchange metricsExchange) {
        return queues.stream()
            .flatMap(topicQueues -> topicQueues.declarables(broadcastExchange, metricsExchange).stream())
            .toList();
    }

    List<TopicQueues> queues() {
        return queues;
    }

    @Override
    public void configureRabbitListeners(RabbitListenerEndpointRegistrar registrar) {
        for (TopicQueues topicQueues : queues) {
            TopicAggregator aggregator = registry.find(topicQueues.topic()).orElseThrow();
            registrar.registerEndpoint(endpoint("content", topicQueues.contentQueue().getName(),
                new TopicContentListener(aggregator, meterRegistry)));
            registrar.registerEndpoint(endpoint("metrics", topicQueues.metricsQueue().getName(),
                new MetricsRequestResponder(aggregator, rabbit, codec)));
            log.info("[AGG] listening for topic={} content={} metrics={}", aggregator.topic(),
                topicQueues.contentQueue().getName(), topicQueues.metricsQueue().getName());
        }
    }

    private static SimpleRabbitListenerEndpoint endpoint(String kind, String queue, MessageListener listener) {
        SimpleRabbitListenerEndpoint endpoint = new SimpleRabbitListenerEndpoint();
        endpoint.setId(kind + "-" + queue);
        endpoint.setQueueNames(queue);
        endpoint.setConcurrency("1");
        endpoint.setAckMode(AcknowledgeMode.NONE);
        endpoint.setExclusive(true);
        endpoint.setMessageListener(listener);
        return endpoint;
    }
}
