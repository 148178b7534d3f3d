package io.docanalytics.model;

/**
 * Failure while turning document text into topics.
 */
public class DocumentAnalyticsException extends Exception {

    public DocumentAnalyticsException(String message) {
        super(message);
    }

    public DocumentAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
