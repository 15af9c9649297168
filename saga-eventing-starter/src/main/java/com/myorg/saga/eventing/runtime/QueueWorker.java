package com.myorg.saga.eventing.runtime;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.eventing.PayloadConverter;
import com.myorg.saga.eventing.SagaDispatcher;
import com.myorg.saga.eventing.context.SagaDispatchOutcome;
import com.myorg.saga.kafka.topology.TopologyProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.kafka.listener.MessageListener;

/**
 * Receive side of one queue. Records whose routing key is not bound to the queue are
 * acknowledged and skipped; everything else is dispatched inside its own unit of work.
 *
 * <p>A handler exception propagates to the container, which leaves the offset uncommitted and
 * hands the record to the queue's error handler (redelivery, then dead letter).
 */
@Slf4j
public class QueueWorker implements MessageListener<String, Object> {

    static final String MDC_QUEUE = "queue";
    static final String MDC_TOPIC = "topic";
    static final String MDC_PARTITION = "partition";
    static final String MDC_OFFSET = "offset";

    private final TopologyProperties.Queue queue;
    private final SagaDispatcher dispatcher;
    private final PayloadConverter converter;
    private final UnitOfWorkFactory unitOfWorkFactory;

    public QueueWorker(TopologyProperties.Queue queue,
                       SagaDispatcher dispatcher,
                       PayloadConverter converter,
                       UnitOfWorkFactory unitOfWorkFactory) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.converter = converter;
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    @Override
    public void onMessage(ConsumerRecord<String, Object> record) {
        MDC.put(MDC_QUEUE, queue.getName());
        MDC.put(MDC_TOPIC, record.topic());
        MDC.put(MDC_PARTITION, String.valueOf(record.partition()));
        MDC.put(MDC_OFFSET, String.valueOf(record.offset()));
        try {
            EventEnvelope env = converter.toEnvelope(record.value());
            if (env == null) {
                log.debug("Skip tombstone key={}", record.key());
                return;
            }
            if (!queue.accepts(env.getEventType())) {
                log.trace("Skip eventType={} not bound to queue", env.getEventType());
                return;
            }

            try (UnitOfWork uow = unitOfWorkFactory.begin(queue.getName() + "/" + env.getEventType())) {
                dispatcher.dispatch(env);
                uow.commit();
            }
        } finally {
            SagaDispatchOutcome.clear();
            MDC.remove(MDC_QUEUE);
            MDC.remove(MDC_TOPIC);
            MDC.remove(MDC_PARTITION);
            MDC.remove(MDC_OFFSET);
        }
    }

    public String queueName() {
        return queue.getName();
    }
}
