package io.docanalytics.worker;

import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP form of the worker contract. Failures are reported in the body with status 200 so that
 * HTTP and AMQP callers see the same reply.
 */
@RestController
public class ProcessController {
  private static final Logger log = LoggerFactory.getLogger(ProcessController.class);
  private final DocumentWorker worker;

  public ProcessController(DocumentWorker worker) {
    this.worker = worker;
  }

  @PostMapping(value = "/process", produces = MediaType.APPLICATION_JSON_VALUE)
  public ProcessResponse process(@RequestBody ProcessRequest request) {
    log.info("[REST] POST /process action={} item={}", request.action(), request.item());
    ProcessResponse response = worker.process(request);
    log.info("[REST] POST /process -> status={}", response.status());
    return response;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProcessResponse unreadable(HttpMessageNotReadableException e) {
    log.warn("[REST] POST /process unreadable body: {}", e.getMostSpecificCause().getMessage());
    return ProcessResponse.error("Invalid request");
  }
}
