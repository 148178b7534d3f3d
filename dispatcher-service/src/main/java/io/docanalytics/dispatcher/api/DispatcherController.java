package io.docanalytics.dispatcher.api;

import io.docanalytics.dispatcher.api.DispatcherApi.Ack;
import io.docanalytics.dispatcher.api.DispatcherApi.AggregatorRegistrationRequest;
import io.docanalytics.dispatcher.api.DispatcherApi.DistributionResponse;
import io.docanalytics.dispatcher.api.DispatcherApi.DocumentsRequest;
import io.docanalytics.dispatcher.api.DispatcherApi.ErrorResponse;
import io.docanalytics.dispatcher.api.DispatcherApi.ResultsResponse;
import io.docanalytics.dispatcher.api.DispatcherApi.WorkerRegistrationRequest;
import io.docanalytics.dispatcher.domain.DistributionResult;
import io.docanalytics.dispatcher.domain.WorkDispatcher;
import io.docanalytics.dispatcher.results.AggregatorDirectory;
import io.docanalytics.dispatcher.results.ResultCollector;
import io.docanalytics.model.InvalidInputException;
import io.docanalytics.model.TopicMetrics;
import io.docanalytics.model.WorkerDescriptor;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class DispatcherController {

    private static final Logger log = LoggerFactory.getLogger(DispatcherController.class);

    private final WorkDispatcher dispatcher;
    private final AggregatorDirectory aggregators;
    private final ResultCollector collector;

    public DispatcherController(WorkDispatcher dispatcher, AggregatorDirectory aggregators, ResultCollector collector) {
        this.dispatcher = dispatcher;
        this.aggregators = aggregators;
        this.collector = collector;
    }

    @PostMapping("/documents")
    public Ack registerDocuments(@RequestBody DocumentsRequest request) {
        if (request == null || request.documents() == null) {
            throw new InvalidInputException("Missing documents");
        }
        log.info("[REST] POST /api/documents count={}", request.documents().size());
        int registered = dispatcher.registerItems(request.documents());
        log.info("[REST] POST /api/documents -> registered={}", registered);
        return Ack.registered(registered);
    }

    @PostMapping("/workers")
    public Ack registerWorker(@RequestBody WorkerRegistrationRequest request) {
        if (request == null || request.worker() == null) {
            throw new InvalidInputException("Missing worker data");
        }
        log.info("[REST] POST /api/workers id={} endpoint={}", request.worker().id(), request.worker().endpoint());
        dispatcher.registerWorker(request.worker());
        return Ack.ok();
    }

    @GetMapping("/workers")
    public List<WorkerDescriptor> workers() {
        return dispatcher.workers();
    }

    @DeleteMapping("/workers/{id}")
    public Ack removeWorker(@PathVariable("id") String id) {
        log.info("[REST] DELETE /api/workers/{}", id);
        int removed = dispatcher.removeWorker(id);
        log.info("[REST] DELETE /api/workers/{} -> removed={}", id, removed);
        return Ack.removed(removed);
    }

    @PostMapping("/distribute")
    public ResponseEntity<?> distribute() {
        log.info("[REST] POST /api/distribute");
        DistributionResult result = dispatcher.distribute();
        if (result instanceof DistributionResult.Completed completed) {
            DistributionResponse body = DistributionResponse.from(completed.outcome());
            log.info("[REST] POST /api/distribute -> status=200 processed={} errors={}", body.processed(), body.errors());
            return ResponseEntity.ok(body);
        }
        DistributionResult.NoWorkersAvailable none = (DistributionResult.NoWorkersAvailable) result;
        log.info("[REST] POST /api/distribute -> status=409 pending={}", none.pendingCount());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ErrorResponse.of("NO_WORKERS_AVAILABLE", "No workers available"));
    }

    @GetMapping("/results")
    public ResultsResponse results() {
        log.info("[REST] GET /api/results");
        Map<String, TopicMetrics> results = collector.collect();
        return new ResultsResponse(DispatcherApi.SUCCESS, results);
    }

    @PostMapping("/aggregators")
    public Ack registerAggregator(@RequestBody AggregatorRegistrationRequest request) {
        if (request == null) {
            throw new InvalidInputException("Missing topic");
        }
        log.info("[REST] POST /api/aggregators topic={}", request.topic());
        aggregators.register(request.topic());
        return Ack.ok();
    }
}
