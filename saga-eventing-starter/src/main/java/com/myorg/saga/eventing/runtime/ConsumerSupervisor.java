package com.myorg.saga.eventing.runtime;

import com.myorg.saga.eventing.PayloadConverter;
import com.myorg.saga.eventing.SagaDispatcher;
import com.myorg.saga.kafka.QueueErrorHandlerFactory;
import com.myorg.saga.kafka.topology.TopologyManager;
import com.myorg.saga.kafka.topology.TopologyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one listener container per declared queue. Each queue has its own consumer group,
 * threads and error handler, so a stalled queue never holds up another one.
 *
 * <p>Starts after {@link TopologyManager} has declared the topics and stops first on shutdown.
 */
@Slf4j
public class ConsumerSupervisor implements SmartLifecycle {

    public static final int PHASE = Integer.MAX_VALUE - 200;

    private final ConsumerFactory<String, Object> consumerFactory;
    private final TopologyProperties topology;
    private final QueueErrorHandlerFactory errorHandlers;
    private final SagaDispatcher dispatcher;
    private final PayloadConverter converter;
    private final UnitOfWorkFactory unitOfWorkFactory;
    private final Duration shutdownTimeout;
    private final String clientIdPrefix;

    private final Map<String, ConcurrentMessageListenerContainer<String, Object>> containers = new LinkedHashMap<>();
    private volatile boolean running;

    public ConsumerSupervisor(ConsumerFactory<String, Object> consumerFactory,
                              TopologyProperties topology,
                              QueueErrorHandlerFactory errorHandlers,
                              SagaDispatcher dispatcher,
                              PayloadConverter converter,
                              UnitOfWorkFactory unitOfWorkFactory,
                              Duration shutdownTimeout,
                              String clientIdPrefix) {
        this.consumerFactory = consumerFactory;
        this.topology = topology;
        this.errorHandlers = errorHandlers;
        this.dispatcher = dispatcher;
        this.converter = converter;
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.shutdownTimeout = shutdownTimeout;
        this.clientIdPrefix = clientIdPrefix;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        for (TopologyProperties.Queue q : topology.getQueues()) {
            ConcurrentMessageListenerContainer<String, Object> c = createContainer(q);
            containers.put(q.getName(), c);
            c.start();
            log.info("Started queue={} exchange={} routingKeys={} concurrency={}",
                    q.getName(), q.getExchange(), q.getRoutingKeys(), q.getConcurrency());
        }
        running = true;
    }

    ConcurrentMessageListenerContainer<String, Object> createContainer(TopologyProperties.Queue q) {
        ContainerProperties cp = new ContainerProperties(q.getExchange());
        cp.setGroupId(q.getName());
        cp.setClientId(clientIdPrefix + "-" + q.getName());
        // commit after each successfully handled record
        cp.setAckMode(ContainerProperties.AckMode.RECORD);
        cp.setShutdownTimeout(shutdownTimeout.toMillis());
        cp.setMessageListener(new QueueWorker(q, dispatcher, converter, unitOfWorkFactory));

        ConcurrentMessageListenerContainer<String, Object> c = new ConcurrentMessageListenerContainer<>(consumerFactory, cp);
        c.setBeanName("saga-queue-" + q.getName());
        c.setConcurrency(q.getConcurrency());
        c.setCommonErrorHandler(errorHandlers.forQueue(q.getName()));
        return c;
    }

    @Override
    public synchronized void stop() {
        containers.forEach((name, c) -> {
            try {
                c.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop queue={}", name, e);
            }
        });
        containers.clear();
        running = false;
        log.info("Consumer supervisor stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public Map<String, ConcurrentMessageListenerContainer<String, Object>> containers() {
        return Collections.unmodifiableMap(containers);
    }
}
