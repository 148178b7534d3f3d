package io.docanalytics.model;

/**
 * Raised when a registration payload is malformed. Registration rejects it before any
 * distribution pass sees the data.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
