package io.docanalytics.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Calls workers that expose {@code POST /process} over HTTP.
 */
public final class HttpWorkerClient implements WorkerClient {

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpWorkerClient(HttpClient httpClient, ObjectMapper mapper, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public ProcessResponse process(WorkerDescriptor worker, String item) throws WorkerCallException {
        WorkerEndpoint endpoint = WorkerEndpoint.parse(worker.endpoint());
        if (endpoint.transport() != WorkerEndpoint.Transport.HTTP) {
            throw new IllegalArgumentException("Not an HTTP worker endpoint: " + worker.endpoint());
        }
        URI uri = URI.create(endpoint.target() + "/process");
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(toJson(ProcessRequest.process(item))))
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new WorkerCallException(WorkerCallException.Reason.TIMEOUT,
                "No reply from " + uri + " within " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new WorkerCallException(WorkerCallException.Reason.TRANSPORT,
                "HTTP call to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerCallException(WorkerCallException.Reason.TRANSPORT,
                "Interrupted while calling " + uri, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new WorkerCallException(WorkerCallException.Reason.REJECTED,
                "HTTP " + response.statusCode() + " - " + Objects.toString(response.body(), ""));
        }
        try {
            ProcessResponse parsed = mapper.readValue(response.body(), ProcessResponse.class);
            if (parsed == null || parsed.status() == null) {
                throw new WorkerCallException(WorkerCallException.Reason.MALFORMED_REPLY,
                    "Reply from " + uri + " has no status");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new WorkerCallException(WorkerCallException.Reason.MALFORMED_REPLY,
                "Unreadable reply from " + uri, e);
        }
    }

    private String toJson(ProcessRequest request) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise process request", e);
        }
    }
}
