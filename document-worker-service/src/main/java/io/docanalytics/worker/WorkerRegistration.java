package io.docanalytics.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Announces this worker to the dispatcher once the request listener is up. A failed
 * announcement is logged; the worker keeps serving requests and can be registered by hand.
 */
public class WorkerRegistration {

  private static final Logger log = LoggerFactory.getLogger(WorkerRegistration.class);

  private final WorkerProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper mapper;

  public WorkerRegistration(WorkerProperties properties, HttpClient httpClient, ObjectMapper mapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.mapper = mapper;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    register();
  }

  /**
   * @return whether the dispatcher accepted the registration
   */
  boolean register() {
    WorkerProperties.Registration registration = properties.registration();
    if (!registration.enabled()) {
      log.info("[REGISTER] self-registration disabled, worker={} queue={}",
          properties.instanceId(), properties.requestQueue());
      return false;
    }
    String dispatcherUrl = registration.dispatcherUrl();
    if (dispatcherUrl == null || dispatcherUrl.isBlank()) {
      log.warn("[REGISTER] self-registration enabled but no dispatcher URL configured");
      return false;
    }
    String base = dispatcherUrl.endsWith("/") ? dispatcherUrl.substring(0, dispatcherUrl.length() - 1) : dispatcherUrl;
    URI uri = URI.create(base + "/api/workers");
    String endpoint = properties.advertisedEndpoint();
    try {
      String body = mapper.writeValueAsString(
          Map.of("worker", Map.of("id", properties.instanceId(), "endpoint", endpoint)));
      HttpRequest request = HttpRequest.newBuilder(uri)
          .timeout(registration.timeout())
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(body))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 == 2) {
        log.info("[REGISTER] registered worker={} endpoint={} with {}", properties.instanceId(), endpoint, base);
        return true;
      }
      log.warn("[REGISTER] dispatcher rejected worker={} status={} body={}",
          properties.instanceId(), response.statusCode(), response.body());
    } catch (JsonProcessingException e) {
      log.warn("[REGISTER] cannot serialise registration", e);
    } catch (IOException e) {
      log.warn("[REGISTER] dispatcher unreachable at {}: {}", uri, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[REGISTER] interrupted while registering with {}", uri);
    }
    return false;
  }
}
