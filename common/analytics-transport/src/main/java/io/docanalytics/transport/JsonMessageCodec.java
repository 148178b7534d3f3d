package io.docanalytics.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

/**
 * Serialises request/response records as JSON AMQP messages.
 */
public final class JsonMessageCodec {

    private final ObjectMapper mapper;

    public JsonMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Message toMessage(Object payload) {
        Objects.requireNonNull(payload, "payload");
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding("UTF-8");
        try {
            return new Message(mapper.writeValueAsBytes(payload), props);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialise " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * Builds a reply that carries the correlation id of {@code request}.
     */
    public Message toReply(Message request, Object payload) {
        Message reply = toMessage(payload);
        String correlationId = request.getMessageProperties().getCorrelationId();
        if (correlationId != null) {
            reply.getMessageProperties().setCorrelationId(correlationId);
        }
        return reply;
    }

    /**
     * @throws IOException when the body is not valid JSON for {@code type}
     */
    public <T> T fromMessage(Message message, Class<T> type) throws IOException {
        Objects.requireNonNull(message, "message");
        byte[] body = message.getBody();
        if (body == null || body.length == 0) {
            throw new IOException("empty message body");
        }
        return mapper.readValue(body, type);
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
