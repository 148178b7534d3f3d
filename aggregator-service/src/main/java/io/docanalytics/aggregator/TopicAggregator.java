package io.docanalytics.aggregator;

import io.docanalytics.model.ContentAnalyzer;
import io.docanalytics.model.ContentMetrics;
import io.docanalytics.model.TopicMetrics;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Running totals for one topic.
 * <p>
 * The four counters live in one immutable {@link TopicMetrics}, so a reader always sees the
 * totals of a whole number of documents and never waits for a fold in progress.
 */
public class TopicAggregator {

    private final String topic;
    private final AtomicReference<TopicMetrics> totals;

    public TopicAggregator(String topic) {
        this.topic = topic;
        this.totals = new AtomicReference<>(TopicMetrics.empty(topic));
    }

    public String topic() {
        return topic;
    }

    /**
     * Counts one document's content for this topic. Empty content still counts as a document.
     */
    public TopicMetrics processContent(String content) {
        ContentMetrics metrics = ContentAnalyzer.analyze(content == null ? "" : content);
        return totals.updateAndGet(current -> current.plus(metrics));
    }

    public TopicMetrics getMetrics() {
        return totals.get();
    }
}
