package io.docanalytics.aggregator;

import io.docanalytics.model.MetricsRequest;
import io.docanalytics.model.MetricsResponse;
import io.docanalytics.transport.JsonMessageCodec;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Address;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageListener;

/**
 * Answers {@code get_metrics} requests for one topic with the aggregator's current snapshot.
 */
public class MetricsRequestResponder implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(MetricsRequestResponder.class);

    private final TopicAggregator aggregator;
    private final AmqpTemplate rabbit;
    private final JsonMessageCodec codec;

    public MetricsRequestResponder(TopicAggregator aggregator, AmqpTemplate rabbit, JsonMessageCodec codec) {
        this.aggregator = aggregator;
        this.rabbit = rabbit;
        this.codec = codec;
    }

    @Override
    public void onMessage(Message request) {
        Address replyTo = request.getMessageProperties().getReplyToAddress();
        if (replyTo == null) {
            log.warn("[AGG] get_metrics request for topic={} has no reply-to, dropping", aggregator.topic());
            return;
        }
        MetricsResponse response = answer(request);
        try {
            rabbit.send(replyTo.getExchangeName(), replyTo.getRoutingKey(), codec.toReply(request, response));
        } catch (AmqpException e) {
            log.warn("[AGG] cannot reply to get_metrics for topic={}: {}", aggregator.topic(), e.getMessage());
        }
    }

    MetricsResponse answer(Message request) {
        MetricsRequest parsed;
        try {
            parsed = codec.fromMessage(request, MetricsRequest.class);
        } catch (IOException e) {
            log.warn("[AGG] unreadable metrics request for topic={}: {}", aggregator.topic(), e.getMessage());
            return MetricsResponse.error("Invalid request");
        }
        if (!parsed.isGetMetrics()) {
            return MetricsResponse.error("Invalid action");
        }
        return MetricsResponse.success(aggregator.getMetrics());
    }
}
