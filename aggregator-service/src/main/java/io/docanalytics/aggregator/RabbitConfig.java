package io.docanalytics.aggregator;

import io.docanalytics.transport.JsonMessageCodec;
import io.docanalytics.transport.Topology;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitConfig {

    @Bean
    DirectExchange broadcastExchange() {
        return new DirectExchange(Topology.BROADCAST_EXCHANGE, true, false);
    }

    @Bean
    DirectExchange metricsExchange() {
        return new DirectExchange(Topology.METRICS_EXCHANGE, true, false);
    }

    @Bean
    AggregatorListenerConfigurer aggregatorListenerConfigurer(TopicAggregatorRegistry registry,
                                                              AmqpTemplate rabbit,
                                                              JsonMessageCodec codec,
                                                              MeterRegistry meterRegistry) {
        return new AggregatorListenerConfigurer(registry, rabbit, codec, meterRegistry);
    }

    @Bean
    Declarables aggregatorDeclarables(AggregatorListenerConfigurer listeners,
                                      DirectExchange broadcastExchange,
                                      DirectExchange metricsExchange) {
        return new Declarables(listeners.declarables(broadcastExchange, metricsExchange));
    }
}
