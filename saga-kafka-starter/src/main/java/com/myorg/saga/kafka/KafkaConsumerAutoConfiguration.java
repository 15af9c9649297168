package com.myorg.saga.kafka;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(ConcurrentMessageListenerContainer.class)
@EnableConfigurationProperties(SagaKafkaProperties.class)
public class KafkaConsumerAutoConfiguration {

    // group.id is not set here: every queue container sets its own
    @Bean
    @ConditionalOnMissingBean
    public ConsumerFactory<String, Object> consumerFactory(SagaKafkaProperties props) {
        Map<String, Object> c = new HashMap<>();
        c.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // a poison record surfaces as DeserializationException instead of killing the poll loop
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        c.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);
        c.put(JsonDeserializer.VALUE_DEFAULT_TYPE, EventEnvelope.class.getName());
        c.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        c.put(JsonDeserializer.TRUSTED_PACKAGES, "com.myorg.saga.contracts.*");

        c.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, props.getConsumer().getMaxPollRecords());
        // commits are driven by the container after each record
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getConsumer().getAutoOffsetReset());
        return new DefaultKafkaConsumerFactory<>(c);
    }
}
