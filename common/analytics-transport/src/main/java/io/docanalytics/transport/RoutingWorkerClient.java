package io.docanalytics.transport;

import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import java.util.Objects;

/**
 * Picks the AMQP or HTTP client according to the worker's endpoint.
 */
public final class RoutingWorkerClient implements WorkerClient {

    private final WorkerClient amqp;
    private final WorkerClient http;

    public RoutingWorkerClient(WorkerClient amqp, WorkerClient http) {
        this.amqp = Objects.requireNonNull(amqp, "amqp");
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public ProcessResponse process(WorkerDescriptor worker, String item) throws WorkerCallException {
        WorkerEndpoint endpoint = WorkerEndpoint.parse(worker.endpoint());
        return switch (endpoint.transport()) {
            case AMQP -> amqp.process(worker, item);
            case HTTP -> http.process(worker, item);
        };
    }
}
