package io.docanalytics.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One {@code (topic, content)} pair published by a worker. The topic travels as its own frame
 * (the AMQP routing key), so it has to fit in a short string and carry no control characters.
 */
public record TopicBroadcast(String topic, String content) {

    public static final int MAX_TOPIC_BYTES = 255;

    public TopicBroadcast {
        topic = requireValidTopic(topic);
        content = Objects.requireNonNull(content, "content");
    }

    public static String requireValidTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        if (topic.getBytes(StandardCharsets.UTF_8).length > MAX_TOPIC_BYTES) {
            throw new IllegalArgumentException("topic exceeds " + MAX_TOPIC_BYTES + " UTF-8 bytes: " + topic);
        }
        for (int i = 0; i < topic.length(); i++) {
            if (Character.isISOControl(topic.charAt(i))) {
                throw new IllegalArgumentException("topic must not contain control characters");
            }
        }
        return topic;
    }
}
