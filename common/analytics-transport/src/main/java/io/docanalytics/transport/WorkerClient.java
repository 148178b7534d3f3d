package io.docanalytics.transport;

import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;

/**
 * Synchronous request/response call from the dispatcher to one worker.
 */
public interface WorkerClient {

    /**
     * Asks {@code worker} to process {@code item} and waits for its reply.
     *
     * @return the worker's reply, which may itself report an error
     * @throws WorkerCallException on timeout, transport failure or an unreadable reply
     */
    ProcessResponse process(WorkerDescriptor worker, String item) throws WorkerCallException;
}
