package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A worker as known to the dispatcher.
 * <p>
 * {@code id} is only used for logging; two descriptors may share an id or an endpoint. The
 * endpoint is either an AMQP request queue ({@code amqp:<queue>} or a bare queue name) or an
 * {@code http(s)://} base URL. Registration payloads may still use the legacy {@code url} or
 * {@code address} keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerDescriptor(String id,
                               @JsonAlias({"url", "address"}) String endpoint) {

    public WorkerDescriptor {
        id = trimToNull(id);
        endpoint = trimToNull(endpoint);
    }

    /**
     * @throws InvalidInputException when the id or endpoint is missing
     */
    public WorkerDescriptor validated() {
        if (id == null) {
            throw new InvalidInputException("Worker data missing id");
        }
        if (endpoint == null) {
            throw new InvalidInputException("Worker data missing endpoint, url or address");
        }
        return this;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
