package io.docanalytics.worker;

import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.transport.JsonMessageCodec;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Answers process requests arriving on the worker's request queue. The returned message goes to
 * the request's reply-to address.
 */
@Component
public class WorkerRequestListener {

  private static final Logger log = LoggerFactory.getLogger(WorkerRequestListener.class);

  private final DocumentWorker worker;
  private final JsonMessageCodec codec;

  public WorkerRequestListener(DocumentWorker worker, JsonMessageCodec codec) {
    this.worker = worker;
    this.codec = codec;
  }

  @RabbitListener(queues = "#{@workerRequestQueue.name}")
  public Message onRequest(Message request) {
    ProcessResponse response;
    try {
      ProcessRequest parsed = codec.fromMessage(request, ProcessRequest.class);
      log.debug("[WORKER] request action={} item={}", parsed.action(), parsed.item());
      response = worker.process(parsed);
    } catch (IOException e) {
      log.warn("[WORKER] unreadable request: {}", e.getMessage());
      response = ProcessResponse.error("Invalid request");
    }
    return codec.toReply(request, response);
  }
}
