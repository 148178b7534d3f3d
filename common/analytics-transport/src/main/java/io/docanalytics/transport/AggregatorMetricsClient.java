package io.docanalytics.transport;

import io.docanalytics.model.MetricsRequest;
import io.docanalytics.model.MetricsResponse;
import io.docanalytics.model.TopicMetrics;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;

/**
 * Asks a topic aggregator for its current snapshot over {@link Topology#METRICS_EXCHANGE}.
 */
public final class AggregatorMetricsClient {

    private static final Logger log = LoggerFactory.getLogger(AggregatorMetricsClient.class);

    private final AmqpTemplate rabbit;
    private final JsonMessageCodec codec;
    private final String exchange;

    public AggregatorMetricsClient(AmqpTemplate rabbit, JsonMessageCodec codec, String exchange) {
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
    }

    /**
     * @return the aggregator's snapshot, or empty when it did not answer in time or answered
     *     with an error
     */
    public Optional<TopicMetrics> fetch(String topic) {
        Message reply;
        try {
            reply = rabbit.sendAndReceive(exchange, topic, codec.toMessage(MetricsRequest.getMetrics()));
        } catch (AmqpException e) {
            log.warn("[COLLECT] get_metrics failed topic={} error={}", topic, e.getMessage());
            return Optional.empty();
        }
        if (reply == null) {
            log.warn("[COLLECT] no get_metrics reply topic={}", topic);
            return Optional.empty();
        }
        try {
            MetricsResponse response = codec.fromMessage(reply, MetricsResponse.class);
            if (!response.isSuccess()) {
                log.warn("[COLLECT] aggregator error topic={} message={}", topic, response.message());
                return Optional.empty();
            }
            return Optional.of(response.metrics());
        } catch (IOException e) {
            log.warn("[COLLECT] unreadable get_metrics reply topic={}", topic, e);
            return Optional.empty();
        }
    }
}
