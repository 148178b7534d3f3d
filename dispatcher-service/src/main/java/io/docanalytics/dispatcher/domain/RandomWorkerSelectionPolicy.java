package io.docanalytics.dispatcher.domain;

import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Uniform random choice with replacement. The dispatcher tracks neither load nor liveness, so it
 * makes no attempt at fairness.
 */
public final class RandomWorkerSelectionPolicy implements WorkerSelectionPolicy {

    private final Random random;

    public RandomWorkerSelectionPolicy() {
        this(new Random());
    }

    public RandomWorkerSelectionPolicy(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Optional<WorkerDescriptor> select(List<WorkerDescriptor> roster) {
        if (roster == null || roster.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(roster.get(random.nextInt(roster.size())));
    }
}
