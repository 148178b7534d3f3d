package io.docanalytics.dispatcher.domain;

import io.docanalytics.model.DistributionOutcome;
import io.docanalytics.model.InvalidInputException;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.WorkerDescriptor;
import io.docanalytics.transport.WorkerCallException;
import io.docanalytics.transport.WorkerClient;
import io.docanalytics.transport.WorkerEndpoint;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Hands registered documents to registered workers, one synchronous call per document.
 * <p>
 * A pass takes the whole pending set, so an item is assigned at most once per registration;
 * failed items are counted and never retried. Only one pass runs at a time. Registration may
 * happen concurrently with a pass: new items wait for the next pass, and roster changes are seen
 * by the running pass from the next item on.
 */
public class WorkDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkDispatcher.class);

    private final WorkerClient workerClient;
    private final WorkerSelectionPolicy selectionPolicy;
    private final DispatchMetrics metrics;
    private final List<WorkerDescriptor> roster = new CopyOnWriteArrayList<>();
    private final ReentrantLock passLock = new ReentrantLock();
    private final Object pendingLock = new Object();
    private List<String> pending = List.of();

    public WorkDispatcher(WorkerClient workerClient, WorkerSelectionPolicy selectionPolicy, DispatchMetrics metrics) {
        this.workerClient = Objects.requireNonNull(workerClient, "workerClient");
        this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Replaces the pending set.
     *
     * @return number of items now pending
     * @throws InvalidInputException when the list is missing or contains a blank identifier
     */
    public int registerItems(Collection<String> items) {
        if (items == null) {
            throw new InvalidInputException("documents must be provided");
        }
        List<String> accepted = new ArrayList<>(items.size());
        int index = 0;
        for (String item : items) {
            index++;
            if (item == null || item.isBlank()) {
                throw new InvalidInputException("document " + index + " is blank");
            }
            accepted.add(item.trim());
        }
        synchronized (pendingLock) {
            pending = List.copyOf(accepted);
        }
        log.info("[REGISTER] documents={}", accepted.size());
        if (log.isDebugEnabled()) {
            for (int i = 0; i < accepted.size(); i++) {
                log.debug("[REGISTER] document {}: {}", i + 1, accepted.get(i));
            }
        }
        return accepted.size();
    }

    /**
     * Appends a worker to the roster. Duplicates are kept.
     *
     * @throws InvalidInputException when the id or endpoint is missing or the endpoint is unusable
     */
    public void registerWorker(WorkerDescriptor worker) {
        if (worker == null) {
            throw new InvalidInputException("worker must be provided");
        }
        WorkerDescriptor valid = worker.validated();
        WorkerEndpoint endpoint = WorkerEndpoint.parse(valid.endpoint());
        roster.add(valid);
        log.info("[REGISTER] worker={} endpoint={} transport={} roster={}",
            valid.id(), valid.endpoint(), endpoint.transport(), roster.size());
    }

    /**
     * Removes every roster entry with the given id.
     *
     * @return number of entries removed
     */
    public int removeWorker(String id) {
        List<WorkerDescriptor> matching = roster.stream()
            .filter(worker -> worker.id().equals(id))
            .toList();
        roster.removeAll(matching);
        if (!matching.isEmpty()) {
            log.info("[REGISTER] removed worker={} entries={} roster={}", id, matching.size(), roster.size());
        }
        return matching.size();
    }

    public List<WorkerDescriptor> workers() {
        return List.copyOf(roster);
    }

    public List<String> pendingItems() {
        synchronized (pendingLock) {
            return pending;
        }
    }

    public Optional<WorkerDescriptor> selectWorker() {
        return selectionPolicy.select(List.copyOf(roster));
    }

    /**
     * Runs one distribution pass over the pending set.
     * <p>
     * Per-item failures (error replies, timeouts, transport errors) are counted in the outcome and
     * never abort the pass. If the roster empties mid-pass the remaining items are counted as
     * errors and reported as unassigned.
     */
    public DistributionResult distribute() {
        passLock.lock();
        try {
            List<String> items;
            synchronized (pendingLock) {
                items = pending;
                if (items.isEmpty()) {
                    log.info("[DISPATCH] no documents to process");
                    metrics.recordPass("empty");
                    return new DistributionResult.Completed(DistributionOutcome.empty());
                }
                if (roster.isEmpty()) {
                    log.error("[DISPATCH] no workers available pending={}", items.size());
                    metrics.recordPass("no_workers");
                    return new DistributionResult.NoWorkersAvailable(items.size());
                }
                pending = List.of();
            }
            return new DistributionResult.Completed(runPass(items));
        } finally {
            passLock.unlock();
        }
    }

    private DistributionOutcome runPass(List<String> items) {
        int total = items.size();
        log.info("[DISPATCH] start documents={} workers={}", total, roster.size());
        int processed = 0;
        int errors = 0;
        Set<String> topics = new LinkedHashSet<>();
        for (int i = 0; i < total; i++) {
            String item = items.get(i);
            Optional<WorkerDescriptor> worker = selectWorker();
            if (worker.isEmpty()) {
                int unassigned = total - i;
                errors += unassigned;
                metrics.recordUnassigned(unassigned);
                metrics.recordPass("roster_emptied");
                log.error("[DISPATCH] roster emptied mid-pass, {} of {} documents left unassigned", unassigned, total);
                return new DistributionOutcome(processed, errors, unassigned, List.copyOf(topics));
            }
            if (dispatchOne(item, i + 1, total, worker.get(), topics)) {
                processed++;
            } else {
                errors++;
            }
        }
        metrics.recordPass("completed");
        log.info("[DISPATCH] completed processed={} errors={}", processed, errors);
        return new DistributionOutcome(processed, errors, 0, List.copyOf(topics));
    }

    private boolean dispatchOne(String item, int position, int total, WorkerDescriptor worker, Set<String> topics) {
        String previousDocument = MDC.get("documentId");
        String previousWorker = MDC.get("workerId");
        MDC.put("documentId", item);
        MDC.put("workerId", worker.id());
        Timer.Sample sample = metrics.startCall();
        boolean success = false;
        try {
            log.info("[DISPATCH] [{}/{}] document={} worker={}", position, total, item, worker.id());
            ProcessResponse response = workerClient.process(worker, item);
            if (response.isSuccess()) {
                success = true;
                topics.addAll(response.topicsOrEmpty());
                log.info("[DISPATCH] processed document={} topics={}", item, response.topicsOrEmpty());
            } else {
                log.error("[DISPATCH] worker failed document={} message={}",
                    item, Objects.toString(response.message(), "Unknown error"));
            }
        } catch (WorkerCallException e) {
            log.error("[DISPATCH] call failed document={} worker={} reason={} error={}",
                item, worker.id(), e.reason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[DISPATCH] unexpected failure document={} worker={}", item, worker.id(), e);
        } finally {
            metrics.recordCall(sample, success);
            restore("documentId", previousDocument);
            restore("workerId", previousWorker);
        }
        return success;
    }

    private static void restore(String key, String previousValue) {
        if (previousValue == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previousValue);
        }
    }
}
