package io.docanalytics.transport;

import io.docanalytics.model.InvalidInputException;
import java.net.URI;
import java.util.Locale;

/**
 * Parsed form of {@link io.docanalytics.model.WorkerDescriptor#endpoint()}.
 * <ul>
 *   <li>{@code http://host:port}, {@code https://...} - HTTP worker</li>
 *   <li>{@code tcp://host:port} - legacy messaging address; the worker's HTTP API listens on
 *   {@value #LEGACY_HTTP_PORT} of the same host, so the given port is replaced</li>
 *   <li>{@code amqp:queue} or a bare {@code queue} - AMQP worker request queue</li>
 * </ul>
 */
public record WorkerEndpoint(Transport transport, String target) {

    public enum Transport {
        AMQP,
        HTTP
    }

    private static final String AMQP_PREFIX = "amqp:";
    private static final String TCP_PREFIX = "tcp://";
    static final int LEGACY_HTTP_PORT = 5555;

    public static WorkerEndpoint parse(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidInputException("Worker endpoint must not be blank");
        }
        String value = endpoint.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return http(value);
        }
        if (lower.startsWith(TCP_PREFIX)) {
            return http(legacyHttpUrl(value.substring(TCP_PREFIX.length())));
        }
        if (lower.startsWith(AMQP_PREFIX)) {
            String queue = value.substring(AMQP_PREFIX.length());
            if (queue.startsWith("//")) {
                queue = queue.substring(2);
            }
            if (queue.isBlank()) {
                throw new InvalidInputException("AMQP worker endpoint is missing a queue name: " + endpoint);
            }
            return new WorkerEndpoint(Transport.AMQP, queue);
        }
        if (value.contains("://")) {
            throw new InvalidInputException("Unsupported worker endpoint scheme: " + endpoint);
        }
        return new WorkerEndpoint(Transport.AMQP, value);
    }

    private static String legacyHttpUrl(String address) {
        String[] parts = address.split(":");
        if (parts.length == 2) {
            return "http://" + parts[0] + ":" + LEGACY_HTTP_PORT;
        }
        return "http://" + address;
    }

    private static WorkerEndpoint http(String url) {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        try {
            URI uri = URI.create(base);
            if (uri.getHost() == null) {
                throw new InvalidInputException("Worker URL has no host: " + url);
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid worker URL: " + url);
        }
        return new WorkerEndpoint(Transport.HTTP, base);
    }
}
