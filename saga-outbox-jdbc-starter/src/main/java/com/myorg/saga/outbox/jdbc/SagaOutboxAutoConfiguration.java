package com.myorg.saga.outbox.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.eventing.SagaEventingProperties;
import com.myorg.saga.eventing.SagaPublisher;
import com.myorg.saga.eventing.autoconfig.SagaEventingAutoConfiguration;
import com.myorg.saga.outbox.OutboxEventEmitter;
import com.myorg.saga.outbox.OutboxWriter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;

@AutoConfiguration(
        after = {
                JacksonAutoConfiguration.class,
                JdbcTemplateAutoConfiguration.class,
                DataSourceTransactionManagerAutoConfiguration.class,
                TransactionAutoConfiguration.class,
                SagaEventingAutoConfiguration.class
        },
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(JdbcTemplate.class)
@EnableConfigurationProperties(SagaOutboxProperties.class)
public class SagaOutboxAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock sagaOutboxClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcOutboxRepository jdbcOutboxRepository(JdbcTemplate jdbc, SagaOutboxProperties props) {
        return new JdbcOutboxRepository(jdbc, props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PlatformTransactionManager.class)
    public TransactionTemplate sagaOutboxTxTemplate(PlatformTransactionManager txManager) {
        return new TransactionTemplate(txManager);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "saga.outbox", name = "enabled", havingValue = "true")
    public OutboxWriter outboxWriter(JdbcTemplate jdbcTemplate,
                                     ObjectProvider<ObjectMapper> mapper,
                                     SagaOutboxProperties props) {
        return new JdbcOutboxWriter(jdbcTemplate, mapper.getIfAvailable(ObjectMapper::new), props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(OutboxWriter.class)
    public OutboxEventEmitter outboxEventEmitter(ObjectProvider<ObjectMapper> mapper,
                                                 OutboxWriter writer,
                                                 ObjectProvider<SagaEventingProperties> eventing,
                                                 Environment env) {
        SagaEventingProperties ep = eventing.getIfAvailable();
        String producer = ep == null ? null : ep.getProducerName();
        if (!StringUtils.hasText(producer)) {
            producer = env.getProperty("spring.application.name", "unknown-service");
        }
        return new OutboxEventEmitter(mapper.getIfAvailable(ObjectMapper::new), writer, producer);
    }

    @Bean(name = "sagaOutboxSchedule")
    public OutboxScheduleValues sagaOutboxScheduleValues(SagaOutboxProperties props) {
        return new OutboxScheduleValues(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboxRelayHooks outboxRelayHooks() {
        return new OutboxRelayHooks() {};
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "saga.outbox.relay", name = "enabled", havingValue = "true")
    @ConditionalOnBean(MeterRegistry.class)
    public OutboxMetrics outboxMetrics(MeterRegistry registry,
                                       JdbcOutboxRepository repo,
                                       Clock clock,
                                       SagaOutboxProperties props) {
        if (!props.getMetrics().isEnabled()) return null;
        return new OutboxMetrics(registry, repo, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "saga.outbox.relay", name = "enabled", havingValue = "true")
    @ConditionalOnBean({SagaPublisher.class, TransactionTemplate.class})
    public OutboxRelay outboxRelay(SagaOutboxProperties props,
                                   JdbcOutboxRepository repo,
                                   SagaPublisher publisher,
                                   ObjectProvider<ObjectMapper> mapper,
                                   TransactionTemplate txTemplate,
                                   Clock clock,
                                   OutboxRelayHooks hooks,
                                   ObjectProvider<OutboxMetrics> metrics) {
        return new OutboxRelay(props, repo, publisher, mapper.getIfAvailable(ObjectMapper::new),
                txTemplate, clock, hooks, metrics.getIfAvailable());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "saga.outbox.relay", name = "enabled", havingValue = "true")
    static class SchedulingConfig {}
}
