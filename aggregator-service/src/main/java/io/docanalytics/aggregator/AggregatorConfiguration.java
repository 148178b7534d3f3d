package io.docanalytics.aggregator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docanalytics.transport.JsonMessageCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AggregatorConfiguration {

    @Bean
    JsonMessageCodec jsonMessageCodec(ObjectMapper objectMapper) {
        return new JsonMessageCodec(objectMapper);
    }

    @Bean
    TopicAggregatorRegistry topicAggregatorRegistry(AggregatorProperties properties) {
        return new TopicAggregatorRegistry(properties.topics());
    }
}
