package io.docanalytics.worker;

import io.docanalytics.transport.RabbitTopicPublisher;
import io.docanalytics.transport.TopicPublisher;
import io.docanalytics.transport.Topology;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitConfig {
  @Bean DirectExchange broadcastExchange() { return new DirectExchange(Topology.BROADCAST_EXCHANGE, true, false); }

  @Bean Queue workerRequestQueue(WorkerProperties properties) {
    return QueueBuilder.nonDurable(properties.requestQueue()).autoDelete().build();
  }

  @Bean TopicPublisher topicPublisher(AmqpTemplate rabbit) {
    return new RabbitTopicPublisher(rabbit, Topology.BROADCAST_EXCHANGE);
  }
}
