package io.docanalytics.dispatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.dispatcher.domain.DispatchMetrics;
import io.docanalytics.dispatcher.domain.RandomWorkerSelectionPolicy;
import io.docanalytics.dispatcher.domain.WorkDispatcher;
import io.docanalytics.dispatcher.domain.WorkerSelectionPolicy;
import io.docanalytics.dispatcher.results.AggregatorDirectory;
import io.docanalytics.dispatcher.results.ResultCollector;
import io.docanalytics.transport.AggregatorMetricsClient;
import io.docanalytics.transport.AmqpWorkerClient;
import io.docanalytics.transport.HttpWorkerClient;
import io.docanalytics.transport.JsonMessageCodec;
import io.docanalytics.transport.RoutingWorkerClient;
import io.docanalytics.transport.Topology;
import io.docanalytics.transport.WorkerClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatcherConfiguration {

    @Bean
    JsonMessageCodec jsonMessageCodec(ObjectMapper objectMapper) {
        return new JsonMessageCodec(objectMapper);
    }

    @Bean
    HttpClient workerHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @Bean
    WorkerClient workerClient(@Qualifier("workerRabbitTemplate") RabbitTemplate workerRabbitTemplate,
                              HttpClient workerHttpClient,
                              JsonMessageCodec codec,
                              DispatcherProperties properties) {
        return new RoutingWorkerClient(
            new AmqpWorkerClient(workerRabbitTemplate, codec),
            new HttpWorkerClient(workerHttpClient, codec.mapper(), properties.callTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerSelectionPolicy workerSelectionPolicy() {
        return new RandomWorkerSelectionPolicy();
    }

    @Bean
    DispatchMetrics dispatchMetrics(MeterRegistry meterRegistry) {
        return new DispatchMetrics(meterRegistry);
    }

    @Bean
    WorkDispatcher workDispatcher(WorkerClient workerClient,
                                  WorkerSelectionPolicy workerSelectionPolicy,
                                  DispatchMetrics dispatchMetrics,
                                  DispatcherProperties properties) {
        WorkDispatcher dispatcher = new WorkDispatcher(workerClient, workerSelectionPolicy, dispatchMetrics);
        properties.workers().forEach(dispatcher::registerWorker);
        return dispatcher;
    }

    @Bean
    AggregatorMetricsClient aggregatorMetricsClient(@Qualifier("metricsRabbitTemplate") RabbitTemplate metricsRabbitTemplate,
                                                    JsonMessageCodec codec) {
        return new AggregatorMetricsClient(metricsRabbitTemplate, codec, Topology.METRICS_EXCHANGE);
    }

    @Bean
    AggregatorDirectory aggregatorDirectory(CollectorProperties properties) {
        return new AggregatorDirectory(properties.topics());
    }

    @Bean
    ResultCollector resultCollector(AggregatorDirectory aggregatorDirectory, AggregatorMetricsClient aggregatorMetricsClient) {
        return new ResultCollector(aggregatorDirectory, aggregatorMetricsClient);
    }
}
