package io.docanalytics.transport;

import io.docanalytics.model.TopicBroadcast;
import java.nio.charset.StandardCharsets;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

/**
 * Maps a {@link TopicBroadcast} onto an AMQP message: the topic is the routing key (mirrored in
 * the {@link Topology#TOPIC_HEADER} header) and the content is the UTF-8 body.
 */
public final class TopicBroadcastCodec {

    private TopicBroadcastCodec() {
    }

    public static Message encode(TopicBroadcast broadcast) {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_TEXT_PLAIN);
        props.setContentEncoding(StandardCharsets.UTF_8.name());
        props.setDeliveryMode(MessageDeliveryMode.NON_PERSISTENT);
        props.setHeader(Topology.TOPIC_HEADER, broadcast.topic());
        return new Message(broadcast.content().getBytes(StandardCharsets.UTF_8), props);
    }

    /**
     * @throws IllegalArgumentException when the message carries no usable topic
     */
    public static TopicBroadcast decode(Message message) {
        MessageProperties props = message.getMessageProperties();
        Object header = props.getHeader(Topology.TOPIC_HEADER);
        String topic = header != null ? header.toString() : props.getReceivedRoutingKey();
        byte[] body = message.getBody();
        String content = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        return new TopicBroadcast(topic, content);
    }
}
