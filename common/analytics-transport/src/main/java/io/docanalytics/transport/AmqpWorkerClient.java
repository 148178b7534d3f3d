package io.docanalytics.transport;

import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import java.io.IOException;
import java.util.Objects;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;

/**
 * Calls workers through their AMQP request queue using the template's request/reply support.
 * The reply timeout is whatever the supplied template is configured with; a {@code null} reply
 * is reported as {@link WorkerCallException.Reason#TIMEOUT}.
 */
public final class AmqpWorkerClient implements WorkerClient {

    private final AmqpTemplate rabbit;
    private final JsonMessageCodec codec;

    public AmqpWorkerClient(AmqpTemplate rabbit, JsonMessageCodec codec) {
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ProcessResponse process(WorkerDescriptor worker, String item) throws WorkerCallException {
        WorkerEndpoint endpoint = WorkerEndpoint.parse(worker.endpoint());
        if (endpoint.transport() != WorkerEndpoint.Transport.AMQP) {
            throw new IllegalArgumentException("Not an AMQP worker endpoint: " + worker.endpoint());
        }
        Message reply;
        try {
            reply = rabbit.sendAndReceive("", endpoint.target(), codec.toMessage(ProcessRequest.process(item)));
        } catch (AmqpException e) {
            throw new WorkerCallException(WorkerCallException.Reason.TRANSPORT,
                "AMQP call to " + endpoint.target() + " failed: " + e.getMessage(), e);
        }
        if (reply == null) {
            throw new WorkerCallException(WorkerCallException.Reason.TIMEOUT,
                "No reply from " + endpoint.target() + " before timeout");
        }
        try {
            ProcessResponse response = codec.fromMessage(reply, ProcessResponse.class);
            if (response.status() == null) {
                throw new WorkerCallException(WorkerCallException.Reason.MALFORMED_REPLY,
                    "Reply from " + endpoint.target() + " has no status");
            }
            return response;
        } catch (IOException e) {
            throw new WorkerCallException(WorkerCallException.Reason.MALFORMED_REPLY,
                "Unreadable reply from " + endpoint.target(), e);
        }
    }
}
