package io.docanalytics.worker;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Worker settings.
 *
 * @param instanceId    id reported to the dispatcher; generated when blank
 * @param requestQueue  AMQP queue the worker takes process requests from; defaults to
 *                      {@code docanalytics.worker.<instanceId>}
 * @param documentsRoot directory searched by file name when an item path does not exist
 * @param registration  optional self-registration with the dispatcher
 */
@Validated
@ConfigurationProperties("docanalytics.worker")
public record WorkerProperties(
    String instanceId,
    String requestQueue,
    @NotNull Path documentsRoot,
    @Valid @DefaultValue Registration registration) {

  static final String QUEUE_PREFIX = "docanalytics.worker.";

  public WorkerProperties {
    if (instanceId == null || instanceId.isBlank()) {
      instanceId = WorkerNameGenerator.generate();
    }
    if (requestQueue == null || requestQueue.isBlank()) {
      requestQueue = QUEUE_PREFIX + instanceId;
    }
  }

  /**
   * @param enabled       whether to register on startup
   * @param dispatcherUrl dispatcher base URL, e.g. {@code http://dispatcher:8080}
   * @param endpoint      endpoint to advertise; the AMQP request queue when blank
   * @param timeout       registration call timeout
   */
  public record Registration(
      @DefaultValue("false") boolean enabled,
      String dispatcherUrl,
      String endpoint,
      @DefaultValue("5s") @NotNull Duration timeout) {
  }

  String advertisedEndpoint() {
    String endpoint = registration.endpoint();
    return endpoint == null || endpoint.isBlank() ? "amqp:" + requestQueue : endpoint.trim();
  }
}
