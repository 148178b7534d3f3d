package io.docanalytics.dispatcher.domain;

import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the worker for the next item.
 */
@FunctionalInterface
public interface WorkerSelectionPolicy {

    /**
     * @param roster current roster snapshot, possibly empty
     * @return the chosen worker, or empty when {@code roster} is empty
     */
    Optional<WorkerDescriptor> select(List<WorkerDescriptor> roster);
}
