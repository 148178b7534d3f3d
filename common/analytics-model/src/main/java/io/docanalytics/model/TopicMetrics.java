package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Running totals kept by one topic aggregator. Values only grow.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopicMetrics(String topic,
                           long lineCount,
                           long wordCount,
                           long charCount,
                           long docCount) {

    public TopicMetrics {
        Objects.requireNonNull(topic, "topic");
    }

    public static TopicMetrics empty(String topic) {
        return new TopicMetrics(topic, 0, 0, 0, 0);
    }

    /**
     * Folds one document's worth of content into these totals.
     */
    public TopicMetrics plus(ContentMetrics content) {
        Objects.requireNonNull(content, "content");
        return new TopicMetrics(
            topic,
            lineCount + content.lineCount(),
            wordCount + content.wordCount(),
            charCount + content.charCount(),
            docCount + 1);
    }
}
