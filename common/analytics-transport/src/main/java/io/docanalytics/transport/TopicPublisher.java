package io.docanalytics.transport;

/**
 * Producer side of the topic broadcast bus.
 */
public interface TopicPublisher {

    /**
     * Broadcasts one chunk of content under {@code topic}. Returns without waiting for
     * subscribers; a topic nobody subscribes to is dropped.
     */
    void publish(String topic, String content);
}
