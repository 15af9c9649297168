package com.myorg.saga.kafka;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(SagaKafkaProperties.class)
public class KafkaProducerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProducerFactory<String, Object> producerFactory(SagaKafkaProperties props, Environment env) {
        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        // one producer per service process; the client id shows up in broker quotas and logs
        p.put(ProducerConfig.CLIENT_ID_CONFIG, env.getProperty("spring.application.name", "saga-service") + "-producer");
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        // consumers bind to EventEnvelope by default type, no __TypeId__ header needed
        p.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        p.put(ProducerConfig.ACKS_CONFIG, props.getProducer().getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, props.getProducer().isIdempotence());
        p.put(ProducerConfig.RETRIES_CONFIG, props.getProducer().getRetries());
        p.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, props.getProducer().getMaxInFlight());
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, props.getProducer().getCompression());
        p.put(ProducerConfig.LINGER_MS_CONFIG, props.getProducer().getLingerMs());
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, props.getProducer().getBatchSize());
        return new DefaultKafkaProducerFactory<>(p);
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> pf) {
        return new KafkaTemplate<>(pf);
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaBrokerConnection kafkaBrokerConnection(ProducerFactory<String, Object> pf,
                                                       KafkaTemplate<String, Object> template) {
        return new KafkaBrokerConnection(pf, template);
    }
}
