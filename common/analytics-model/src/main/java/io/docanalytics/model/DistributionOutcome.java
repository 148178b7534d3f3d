package io.docanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Result of one distribution pass. Never merged across passes.
 *
 * @param processedCount  items a worker reported as processed
 * @param errorCount      items that failed, including {@code unassignedCount}
 * @param unassignedCount items never handed to a worker because the roster emptied mid-pass
 * @param topics          topics reported by workers, in first-seen order (informational)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistributionOutcome(int processedCount,
                                  int errorCount,
                                  int unassignedCount,
                                  List<String> topics) {

    private static final DistributionOutcome EMPTY = new DistributionOutcome(0, 0, 0, List.of());

    public DistributionOutcome {
        if (processedCount < 0 || errorCount < 0 || unassignedCount < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (unassignedCount > errorCount) {
            throw new IllegalArgumentException("unassigned items are counted as errors");
        }
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public DistributionOutcome(int processedCount, int errorCount) {
        this(processedCount, errorCount, 0, List.of());
    }

    public static DistributionOutcome empty() {
        return EMPTY;
    }

    public int total() {
        return processedCount + errorCount;
    }
}
