package com.myorg.saga.fulfillment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.eventing.DefaultSagaDispatcher;
import com.myorg.saga.eventing.HandlerRegistry;
import com.myorg.saga.eventing.IdempotentSagaDispatcher;
import com.myorg.saga.eventing.JacksonPayloadConverter;
import com.myorg.saga.eventing.SagaHandlerScanner;
import com.myorg.saga.eventing.idempotency.JdbcIdempotencyStore;
import com.myorg.saga.eventing.runtime.QueueWorker;
import com.myorg.saga.eventing.runtime.TransactionalUnitOfWorkFactory;
import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import com.myorg.saga.kafka.topology.TopologyProperties;
import com.myorg.saga.outbox.OutboxEventEmitter;
import com.myorg.saga.outbox.jdbc.JdbcOutboxRepository;
import com.myorg.saga.outbox.jdbc.JdbcOutboxWriter;
import com.myorg.saga.outbox.jdbc.OutboxRelay;
import com.myorg.saga.outbox.jdbc.OutboxRelayHooks;
import com.myorg.saga.outbox.jdbc.SagaOutboxProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;

/**
 * One service wired by hand the way its Spring context wires it: own database, outbox writer and
 * relay, handler registry behind the idempotent dispatcher, one worker per queue.
 */
class ServiceNode {

    final String name;
    final JdbcTemplate jdbc;
    final DataSourceTransactionManager txManager;
    final TransactionTemplate tx;
    final FulfillmentEventEmitter emitter;

    private final ObjectMapper mapper;
    private final Clock clock;
    private final InProcessBroker broker;
    private final OutboxRelay relay;
    private final HandlerRegistry registry = new HandlerRegistry();
    private final SagaHandlerScanner scanner;

    ServiceNode(String name, DataSource ds, ObjectMapper mapper, Clock clock, InProcessBroker broker) {
        this.name = name;
        this.mapper = mapper;
        this.clock = clock;
        this.broker = broker;
        this.jdbc = new JdbcTemplate(ds);
        this.txManager = new DataSourceTransactionManager(ds);
        this.tx = new TransactionTemplate(txManager);

        SagaOutboxProperties props = new SagaOutboxProperties();
        props.setEnabled(true);
        props.getRelay().setEnabled(true);
        props.getRelay().setSchedulingEnabled(false);
        JdbcOutboxRepository repo = new JdbcOutboxRepository(jdbc, props);
        this.emitter = new FulfillmentEventEmitter(
                new OutboxEventEmitter(mapper, new JdbcOutboxWriter(jdbc, mapper, props), name));
        this.relay = new OutboxRelay(props, repo, broker, mapper, tx, clock, new OutboxRelayHooks() {}, null);
        this.scanner = new SagaHandlerScanner(null, registry, mapper);
    }

    ServiceNode handlers(Object... beans) {
        for (Object bean : beans) {
            scanner.register(bean);
        }
        return this;
    }

    ServiceNode bind(String queueName, String exchange, String... routingKeys) {
        TopologyProperties.Queue queue = new TopologyProperties.Queue();
        queue.setName(queueName);
        queue.setExchange(exchange);
        queue.setRoutingKeys(List.of(routingKeys));

        IdempotentSagaDispatcher dispatcher = new IdempotentSagaDispatcher(
                new DefaultSagaDispatcher(registry, false),
                new JdbcIdempotencyStore(jdbc, "processed_event", clock));
        broker.bind(exchange, new QueueWorker(queue, dispatcher, new JacksonPayloadConverter(mapper),
                new TransactionalUnitOfWorkFactory(txManager)));
        return this;
    }

    int relay() {
        return relay.runOnce();
    }
}
