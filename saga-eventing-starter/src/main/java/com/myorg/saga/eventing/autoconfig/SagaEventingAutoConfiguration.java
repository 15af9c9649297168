package com.myorg.saga.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.eventing.DefaultSagaDispatcher;
import com.myorg.saga.eventing.HandlerRegistry;
import com.myorg.saga.eventing.IdempotentSagaDispatcher;
import com.myorg.saga.eventing.JacksonPayloadConverter;
import com.myorg.saga.eventing.KafkaSagaPublisher;
import com.myorg.saga.eventing.PayloadConverter;
import com.myorg.saga.eventing.SagaDispatcher;
import com.myorg.saga.eventing.SagaEventingProperties;
import com.myorg.saga.eventing.SagaHandlerScanner;
import com.myorg.saga.eventing.SagaPublisher;
import com.myorg.saga.eventing.idempotency.IdempotencyGuard;
import com.myorg.saga.eventing.idempotency.IdempotencyStore;
import com.myorg.saga.eventing.idempotency.InMemoryIdempotencyStore;
import com.myorg.saga.eventing.idempotency.KeyPrefixes;
import com.myorg.saga.eventing.runtime.ConsumerSupervisor;
import com.myorg.saga.eventing.runtime.NoopUnitOfWorkFactory;
import com.myorg.saga.eventing.runtime.TransactionalUnitOfWorkFactory;
import com.myorg.saga.eventing.runtime.UnitOfWorkFactory;
import com.myorg.saga.kafka.KafkaBrokerConnection;
import com.myorg.saga.kafka.KafkaConsumerAutoConfiguration;
import com.myorg.saga.kafka.KafkaErrorHandlingAutoConfiguration;
import com.myorg.saga.kafka.KafkaProducerAutoConfiguration;
import com.myorg.saga.kafka.QueueErrorHandlerFactory;
import com.myorg.saga.kafka.SagaKafkaAutoConfiguration;
import com.myorg.saga.kafka.topology.TopologyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.util.StringUtils;

import java.time.Clock;

@Slf4j
@AutoConfiguration(after = {
        JacksonAutoConfiguration.class,
        TransactionAutoConfiguration.class,
        SagaKafkaAutoConfiguration.class,
        KafkaProducerAutoConfiguration.class,
        KafkaConsumerAutoConfiguration.class,
        KafkaErrorHandlingAutoConfiguration.class,
        SagaEventingJdbcAutoConfiguration.class
})
@EnableConfigurationProperties(SagaEventingProperties.class)
public class SagaEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaHandlerScanner sagaHandlerScanner(ApplicationContext ctx, HandlerRegistry registry, ObjectMapper mapper) {
        return new SagaHandlerScanner(ctx, registry, mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadConverter payloadConverter(ObjectMapper mapper) {
        return new JacksonPayloadConverter(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(KafkaBrokerConnection.class)
    public SagaPublisher sagaPublisher(KafkaBrokerConnection connection,
                                       ObjectMapper mapper,
                                       SagaEventingProperties props,
                                       Environment env) {
        return new KafkaSagaPublisher(connection, mapper, producerName(props, env));
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaDispatcher sagaDispatcher(HandlerRegistry registry,
                                         SagaEventingProperties props,
                                         ObjectProvider<IdempotencyStore> storeProvider) {
        SagaDispatcher base = new DefaultSagaDispatcher(registry, props.isIgnoreUnknownEventType());

        IdempotencyStore store = storeProvider.getIfAvailable();
        if (store != null && props.getIdempotency().isEnabled()) {
            return new IdempotentSagaDispatcher(base, store);
        }
        return base;
    }

    @Bean
    @ConditionalOnMissingBean
    public UnitOfWorkFactory unitOfWorkFactory(ObjectProvider<PlatformTransactionManager> txManager) {
        PlatformTransactionManager tm = txManager.getIfUnique();
        if (tm == null) {
            log.info("No unique PlatformTransactionManager: consumer units of work are not transactional");
            return new NoopUnitOfWorkFactory();
        }
        return new TransactionalUnitOfWorkFactory(tm);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ConsumerFactory.class, QueueErrorHandlerFactory.class})
    @ConditionalOnProperty(prefix = "saga.eventing.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsumerSupervisor consumerSupervisor(ConsumerFactory<String, Object> consumerFactory,
                                                 TopologyProperties topology,
                                                 QueueErrorHandlerFactory errorHandlers,
                                                 SagaDispatcher dispatcher,
                                                 PayloadConverter converter,
                                                 UnitOfWorkFactory unitOfWorkFactory,
                                                 SagaEventingProperties props,
                                                 Environment env) {
        return new ConsumerSupervisor(consumerFactory, topology, errorHandlers, dispatcher, converter,
                unitOfWorkFactory, props.getConsumer().getShutdownTimeout(), producerName(props, env));
    }

    // store=memory, or store=auto when neither Redis nor JDBC produced a store
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(IdempotencyStore.class)
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "enabled", havingValue = "true")
    public IdempotencyStore idempotencyStore(SagaEventingProperties props, Environment env) {
        var idem = props.getIdempotency();
        String store = idem.getStore() == null ? "auto" : idem.getStore().toLowerCase();
        if (!"memory".equals(store) && !"auto".equals(store)) {
            throw new IllegalStateException("saga.eventing.idempotency.store=" + store
                    + " but its backing bean is missing (RedisConnectionFactory for redis, JdbcTemplate for jdbc)");
        }
        String prefix = KeyPrefixes.forService(idem.getKeyPrefix(), env);
        log.info("Idempotency store: memory (prefix={})", prefix);
        return new InMemoryIdempotencyStore(prefix, idem.getTtl(), idem.getProcessingTtl(),
                idem.getMaxEntries(), idem.getCleanupInterval(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "enabled", havingValue = "true")
    public IdempotencyGuard idempotencyGuard(SagaEventingProperties props, Environment env, IdempotencyStore store) {
        return new IdempotencyGuard(props, env, store);
    }

    private static String producerName(SagaEventingProperties props, Environment env) {
        String producer = props.getProducerName();
        if (!StringUtils.hasText(producer)) {
            producer = env.getProperty("spring.application.name", "unknown-service");
        }
        return producer;
    }
}
