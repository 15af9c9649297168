package com.myorg.saga.observability;

import com.myorg.saga.eventing.SagaDispatcher;
import com.myorg.saga.eventing.autoconfig.SagaEventingAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(
        after = SagaEventingAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
)
@ConditionalOnClass(SagaDispatcher.class)
@EnableConfigurationProperties(SagaObservabilityProperties.class)
public class SagaObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public SagaMetrics sagaMetrics(MeterRegistry registry, Environment env, SagaObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new SagaMetrics(registry, app, props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/saga.event.* exists before traffic.
     */
    @Bean
    public SmartLifecycle sagaMetricsPreRegisterLifecycle(SagaObservabilityProperties props,
                                                          ObjectProvider<SagaMetrics> metricsProvider) {
        return new SmartLifecycle() {
            private volatile boolean running;

            @Override
            public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    SagaMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                }
                running = true;
            }

            @Override
            public void stop() {
                running = false;
            }

            @Override
            public boolean isRunning() {
                return running;
            }

            @Override
            public int getPhase() {
                return Integer.MIN_VALUE;
            }
        };
    }

    @Bean
    public static BeanPostProcessor observingDispatcherBpp(ObjectProvider<SagaObservabilityProperties> propsProvider,
                                                           ObjectProvider<SagaMetrics> metricsProvider) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof SagaDispatcher dispatcher)) return bean;
                if (bean instanceof ObservingSagaDispatcher) return bean;

                SagaObservabilityProperties props = propsProvider.getObject();
                if (!props.isEnabled()) return bean;
                return new ObservingSagaDispatcher(dispatcher, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
