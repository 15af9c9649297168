package com.myorg.saga.eventing.autoconfig;

import com.myorg.saga.eventing.SagaEventingProperties;
import com.myorg.saga.eventing.idempotency.IdempotencyStore;
import com.myorg.saga.eventing.idempotency.KeyPrefixes;
import com.myorg.saga.eventing.idempotency.RedisIdempotencyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis idempotency store. Kept apart from {@link SagaEventingAutoConfiguration} so services
 * without Redis on the classpath still load the starter.
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(SagaEventingProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
public class SagaEventingRedisAutoConfiguration {

    /**
     * store=redis: a RedisConnectionFactory must exist (Spring Boot creates one from spring.data.redis.*).
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "enabled", havingValue = "true")
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "store", havingValue = "redis")
    static class StrictRedisIdempotencyConfig {

        @Bean
        @ConditionalOnMissingBean(IdempotencyStore.class)
        public IdempotencyStore idempotencyStore(SagaEventingProperties props, RedisConnectionFactory cf, Environment env) {
            var idem = props.getIdempotency();
            if (!idem.getRedis().isEnabled()) {
                throw new IllegalStateException("saga.eventing.idempotency.store=redis but saga.eventing.idempotency.redis.enabled=false");
            }
            return redisStore(props, new StringRedisTemplate(cf), env);
        }
    }

    /**
     * store=auto: Redis wins when a RedisConnectionFactory bean exists.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "enabled", havingValue = "true")
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency", name = "store", havingValue = "auto", matchIfMissing = true)
    @ConditionalOnProperty(prefix = "saga.eventing.idempotency.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnBean(RedisConnectionFactory.class)
    static class AutoRedisIdempotencyConfig {

        @Bean
        @ConditionalOnMissingBean(IdempotencyStore.class)
        public IdempotencyStore idempotencyStore(SagaEventingProperties props, RedisConnectionFactory cf, Environment env) {
            return redisStore(props, new StringRedisTemplate(cf), env);
        }
    }

    private static IdempotencyStore redisStore(SagaEventingProperties props, StringRedisTemplate redis, Environment env) {
        var idem = props.getIdempotency();
        String prefix = KeyPrefixes.forService(idem.getRedis().getKeyPrefix(), env);
        log.info("Idempotency store: redis (prefix={})", prefix);
        return new RedisIdempotencyStore(redis, idem.getTtl(), idem.getProcessingTtl(), prefix);
    }
}
