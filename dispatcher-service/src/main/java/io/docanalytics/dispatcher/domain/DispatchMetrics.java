package io.docanalytics.dispatcher.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;

/**
 * Micrometer meters for distribution passes and individual worker calls.
 */
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter processed;
    private final Counter failed;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.processed = itemCounter("processed");
        this.failed = itemCounter("error");
    }

    Timer.Sample startCall() {
        return Timer.start(registry);
    }

    void recordCall(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("docanalytics.dispatch.call.duration")
            .description("Latency of dispatcher to worker calls")
            .tag("outcome", success ? "success" : "error")
            .register(registry));
        (success ? processed : failed).increment();
    }

    void recordUnassigned(int count) {
        failed.increment(count);
    }

    void recordPass(String result) {
        registry.counter("docanalytics.dispatch.passes", "result", result).increment();
    }

    private Counter itemCounter(String outcome) {
        return Counter.builder("docanalytics.dispatch.items")
            .description("Work items handled by distribution passes")
            .tag("outcome", outcome)
            .register(registry);
    }
}
