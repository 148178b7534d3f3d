package io.docanalytics.transport;

import io.docanalytics.model.TopicBroadcast;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpTemplate;

/**
 * Publishes broadcasts to the direct {@link Topology#BROADCAST_EXCHANGE}, one message per topic.
 */
public final class RabbitTopicPublisher implements TopicPublisher {

    private static final Logger log = LoggerFactory.getLogger(RabbitTopicPublisher.class);

    private final AmqpTemplate rabbit;
    private final String exchange;

    public RabbitTopicPublisher(AmqpTemplate rabbit, String exchange) {
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
    }

    @Override
    public void publish(String topic, String content) {
        TopicBroadcast broadcast = new TopicBroadcast(topic, content);
        rabbit.send(exchange, broadcast.topic(), TopicBroadcastCodec.encode(broadcast));
        log.debug("Published {} chars for topic '{}' to {}", content.length(), topic, exchange);
    }
}
