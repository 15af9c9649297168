package com.myorg.saga.eventing.autoconfig;

import com.myorg.saga.eventing.SagaEventingProperties;
import com.myorg.saga.eventing.idempotency.IdempotencyStore;
import com.myorg.saga.eventing.idempotency.JdbcIdempotencyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * JDBC idempotency store for store=jdbc, or store=auto without Redis.
 * The table comes from the Flyway script under {@code db/eventing}.
 */
@Slf4j
@AutoConfiguration(after = {JdbcTemplateAutoConfiguration.class, SagaEventingRedisAutoConfiguration.class})
@EnableConfigurationProperties(SagaEventingProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "enabled", havingValue = "true")
@ConditionalOnExpression("'${saga.eventing.idempotency.store:auto}'.toLowerCase() == 'jdbc' "
        + "|| '${saga.eventing.idempotency.store:auto}'.toLowerCase() == 'auto'")
public class SagaEventingJdbcAutoConfiguration {

    @Bean
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean(IdempotencyStore.class)
    public IdempotencyStore idempotencyStore(JdbcTemplate jdbc, SagaEventingProperties props) {
        String table = props.getIdempotency().getTable();
        log.info("Idempotency store: jdbc (table={})", table);
        return new JdbcIdempotencyStore(jdbc, table, Clock.systemUTC());
    }
}
