package io.docanalytics.worker;

import io.docanalytics.model.DocumentAnalyticsException;
import io.docanalytics.model.ProcessRequest;
import io.docanalytics.model.ProcessResponse;
import io.docanalytics.model.TopicExtractor;
import io.docanalytics.transport.TopicPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpException;

/**
 * Processes one document per request: read it, split it into topics and publish every topic's
 * content on the broadcast bus. Every failure is turned into an error response.
 */
public class DocumentWorker {

  private static final Logger log = LoggerFactory.getLogger(DocumentWorker.class);

  private final DocumentPathResolver pathResolver;
  private final TopicExtractor extractor;
  private final TopicPublisher publisher;
  private final Counter processed;
  private final Counter failed;
  private final Counter published;

  public DocumentWorker(DocumentPathResolver pathResolver,
                        TopicExtractor extractor,
                        TopicPublisher publisher,
                        MeterRegistry registry) {
    this.pathResolver = pathResolver;
    this.extractor = extractor;
    this.publisher = publisher;
    this.processed = documents(registry, "processed");
    this.failed = documents(registry, "error");
    this.published = Counter.builder("docanalytics.worker.topics.published")
        .description("Topic broadcasts published by this worker")
        .register(registry);
  }

  public ProcessResponse process(ProcessRequest request) {
    if (request == null || !request.isProcess()) {
      failed.increment();
      return ProcessResponse.error("Invalid action");
    }
    String item = request.item();
    if (item == null || item.isBlank()) {
      failed.increment();
      return ProcessResponse.error("Missing item parameter");
    }
    String previous = MDC.get("documentId");
    MDC.put("documentId", item);
    try {
      ProcessResponse response = processItem(item);
      (response.isSuccess() ? processed : failed).increment();
      return response;
    } catch (RuntimeException e) {
      log.error("[WORKER] unexpected error processing {}", item, e);
      failed.increment();
      return ProcessResponse.error("Unexpected error: " + e.getMessage());
    } finally {
      if (previous == null) {
        MDC.remove("documentId");
      } else {
        MDC.put("documentId", previous);
      }
    }
  }

  private ProcessResponse processItem(String item) {
    Optional<Path> path = pathResolver.resolve(item);
    if (path.isEmpty()) {
      log.error("[WORKER] file not found: {}", item);
      return ProcessResponse.error("File not found: " + item);
    }
    Map<String, String> topics;
    try {
      String content = Files.readString(path.get(), StandardCharsets.UTF_8);
      topics = extractor.extract(content);
    } catch (CharacterCodingException e) {
      log.error("[WORKER] {} is not valid UTF-8", path.get());
      return ProcessResponse.error("Error reading file: not valid UTF-8");
    } catch (IOException e) {
      log.error("[WORKER] cannot read {}: {}", path.get(), e.getMessage());
      return ProcessResponse.error("Error reading file: " + e.getMessage());
    } catch (DocumentAnalyticsException e) {
      log.error("[WORKER] cannot extract topics from {}: {}", path.get(), e.getMessage());
      return ProcessResponse.error(e.getMessage());
    }

    List<String> sent = new ArrayList<>(topics.size());
    for (Map.Entry<String, String> topic : topics.entrySet()) {
      try {
        publisher.publish(topic.getKey(), topic.getValue());
        published.increment();
        sent.add(topic.getKey());
      } catch (IllegalArgumentException e) {
        log.warn("[WORKER] skipping topic of {}: {}", item, e.getMessage());
      } catch (AmqpException e) {
        log.error("[WORKER] publish failed for {} topic={}", item, topic.getKey(), e);
        return ProcessResponse.error("Error publishing topic '" + topic.getKey() + "': " + e.getMessage());
      }
    }
    log.info("[WORKER] processed {} topics={}", item, sent);
    return ProcessResponse.success(item, sent);
  }

  private static Counter documents(MeterRegistry registry, String outcome) {
    return Counter.builder("docanalytics.worker.documents")
        .description("Process requests handled by this worker")
        .tag("outcome", outcome)
        .register(registry);
  }
}
