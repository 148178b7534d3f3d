package io.docanalytics.dispatcher.config;

import io.docanalytics.transport.Topology;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Request/reply templates. Worker calls and metrics polls get separate templates because the
 * reply timeout is a template-wide setting.
 */
@Configuration
public class RabbitConfig {

    @Bean
    DirectExchange metricsExchange() {
        return new DirectExchange(Topology.METRICS_EXCHANGE, true, false);
    }

    @Bean
    RabbitTemplate workerRabbitTemplate(ConnectionFactory connectionFactory, DispatcherProperties properties) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setReplyTimeout(properties.callTimeout().toMillis());
        return template;
    }

    @Bean
    RabbitTemplate metricsRabbitTemplate(ConnectionFactory connectionFactory, CollectorProperties properties) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setReplyTimeout(properties.timeout().toMillis());
        return template;
    }
}
