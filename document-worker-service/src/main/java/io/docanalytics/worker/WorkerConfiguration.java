package io.docanalytics.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.model.TopicExtractor;
import io.docanalytics.transport.JsonMessageCodec;
import io.docanalytics.transport.TopicPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfiguration {
  @Bean JsonMessageCodec jsonMessageCodec(ObjectMapper objectMapper) { return new JsonMessageCodec(objectMapper); }

  @Bean DocumentPathResolver documentPathResolver(WorkerProperties properties) {
    return new DocumentPathResolver(properties.documentsRoot());
  }

  @Bean TopicExtractor topicExtractor() { return new TopicExtractor(); }

  @Bean DocumentWorker documentWorker(DocumentPathResolver resolver,
                                      TopicExtractor extractor,
                                      TopicPublisher publisher,
                                      MeterRegistry registry) {
    return new DocumentWorker(resolver, extractor, publisher, registry);
  }

  @Bean WorkerRegistration workerRegistration(WorkerProperties properties, ObjectMapper objectMapper) {
    return new WorkerRegistration(properties, HttpClient.newHttpClient(), objectMapper);
  }
}
