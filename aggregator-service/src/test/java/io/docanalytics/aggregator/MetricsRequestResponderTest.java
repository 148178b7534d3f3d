package io.docanalytics.aggregator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.model.MetricsRequest;
import io.docanalytics.model.MetricsResponse;
import io.docanalytics.model.TopicMetrics;
import io.docanalytics.transport.JsonMessageCodec;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

@ExtendWith(MockitoExtension.class)
class MetricsRequestResponderTest {

    @Mock
    AmqpTemplate rabbit;

    private final JsonMessageCodec codec = new JsonMessageCodec(new ObjectMapper());
    private final TopicAggregator aggregator = new TopicAggregator("Intro");

    @Test
    void repliesWithSnapshotToReplyAddress() throws Exception {
        aggregator.processContent("Line 1\nLine 2\nLine 3 with more words");
        Message request = codec.toMessage(MetricsRequest.getMetrics());
        request.getMessageProperties().setReplyTo("amq.rabbitmq.reply-to.abc");
        request.getMessageProperties().setCorrelationId("c-1");

        new MetricsRequestResponder(aggregator, rabbit, codec).onMessage(request);

        ArgumentCaptor<Message> reply = ArgumentCaptor.forClass(Message.class);
        verify(rabbit).send(eq(""), eq("amq.rabbitmq.reply-to.abc"), reply.capture());
        assertThat(reply.getValue().getMessageProperties().getCorrelationId()).isEqualTo("c-1");
        MetricsResponse response = codec.fromMessage(reply.getValue(), MetricsResponse.class);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.metrics()).isEqualTo(new TopicMetrics("Intro", 3, 9, 34, 1));
    }

    @Test
    void unknownActionIsRejected() {
        MetricsResponse response = new MetricsRequestResponder(aggregator, rabbit, codec)
            .answer(codec.toMessage(new MetricsRequest("reset")));

        assertThat(response.status()).isEqualTo("error");
        assertThat(response.message()).isEqualTo("Invalid action");
    }

    @Test
    void unreadableRequestIsRejected() {
        Message request = new Message("{broken".getBytes(StandardCharsets.UTF_8), new MessageProperties());

        MetricsResponse response = new MetricsRequestResponder(aggregator, rabbit, codec).answer(request);

        assertThat(response.message()).isEqualTo("Invalid request");
    }

    @Test
    void requestWithoutReplyToIsDropped() {
        new MetricsRequestResponder(aggregator, rabbit, codec).onMessage(codec.toMessage(MetricsRequest.getMetrics()));

        verify(rabbit, never()).send(anyString(), anyString(), any(Message.class));
    }
}
