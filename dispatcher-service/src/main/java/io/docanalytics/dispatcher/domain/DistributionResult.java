package io.docanalytics.dispatcher.domain;

import io.docanalytics.model.DistributionOutcome;
import java.util.Objects;

/**
 * Outcome of {@link WorkDispatcher#distribute()}: either a completed pass or the one pass-level
 * failure, a non-empty pending set with nobody to send it to.
 */
public sealed interface DistributionResult permits DistributionResult.Completed, DistributionResult.NoWorkersAvailable {

    record Completed(DistributionOutcome outcome) implements DistributionResult {

        public Completed {
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    /**
     * @param pendingCount items still waiting; they stay registered for the next pass
     */
    record NoWorkersAvailable(int pendingCount) implements DistributionResult {
    }
}
