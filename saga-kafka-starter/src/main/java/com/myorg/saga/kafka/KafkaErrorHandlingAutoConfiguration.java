package com.myorg.saga.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DefaultErrorHandler;

import java.time.Clock;

@AutoConfiguration(after = KafkaProducerAutoConfiguration.class)
@ConditionalOnClass(DefaultErrorHandler.class)
@EnableConfigurationProperties(SagaKafkaProperties.class)
public class KafkaErrorHandlingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SagaDlqReasonClassifier sagaDlqReasonClassifier() {
        return new DefaultSagaDlqReasonClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueErrorHandlerFactory queueErrorHandlerFactory(SagaKafkaProperties props,
                                                             ObjectProvider<KafkaTemplate<String, Object>> templateProvider,
                                                             SagaDlqReasonClassifier classifier,
                                                             Environment env,
                                                             ObjectProvider<MeterRegistry> registryProvider) {
        KafkaTemplate<String, Object> template = templateProvider.getIfAvailable();
        if (props.getDlq().isEnabled() && template == null) {
            throw new IllegalStateException(
                    "saga.kafka.dlq.enabled=true but no KafkaTemplate<String,Object> bean is available for dead-lettering");
        }
        String service = env.getProperty("spring.application.name", "unknown-service");
        return new QueueErrorHandlerFactory(props, template, classifier, service, registryProvider, Clock.systemUTC());
    }

    /**
     * Pre-register the base meters so /actuator/metrics/saga.kafka.* exists before the first retry.
     */
    @Bean
    public ApplicationRunner sagaKafkaMetricsPreregister(ObjectProvider<MeterRegistry> registryProvider) {
        return args -> {
            MeterRegistry reg = registryProvider.getIfAvailable();
            if (reg == null) return;
            Counter.builder("saga.kafka.retry").register(reg);
            Counter.builder("saga.kafka.dlq").register(reg);
            Counter.builder("saga.kafka.recovery_failed").register(reg);
        };
    }
}
