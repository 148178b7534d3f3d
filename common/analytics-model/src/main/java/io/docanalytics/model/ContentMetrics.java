package io.docanalytics.model;

/**
 * Line, word and character counts for one span of text.
 */
public record ContentMetrics(long lineCount, long wordCount, long charCount) {

    public static final ContentMetrics ZERO = new ContentMetrics(0, 0, 0);

    public ContentMetrics {
        if (lineCount < 0 || wordCount < 0 || charCount < 0) {
            throw new IllegalArgumentException("metrics must not be negative");
        }
    }
}
