package com.myorg.saga.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.conventions.CoreHeaders;
import com.myorg.saga.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaRetryableException;
import com.myorg.saga.kafka.KafkaBrokerConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.support.SendResult;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class KafkaSagaPublisher implements SagaPublisher {

    private final KafkaBrokerConnection connection;
    private final ObjectMapper mapper;
    private final String producerName;

    public KafkaSagaPublisher(KafkaBrokerConnection connection, ObjectMapper mapper, String producerName) {
        this.connection = connection;
        this.mapper = mapper;
        this.producerName = producerName;
    }

    @Override
    public CompletableFuture<?> publish(String exchange, String routingKey, String correlationId, Object payload) {
        EventEnvelope env = EnvelopeBuilder.wrap(
                mapper,
                routingKey,
                1,
                correlationId,
                correlationId,
                null,
                producerName,
                payload
        );
        return publish(exchange, env);
    }

    @Override
    public CompletableFuture<?> publish(String exchange, EventEnvelope env) {
        if (!StringUtils.hasText(env.getCorrelationId())) {
            throw new IllegalArgumentException("Envelope " + env.getEventId() + " has no correlationId");
        }

        ProducerRecord<String, Object> record = new ProducerRecord<>(exchange, env.getCorrelationId(), env);
        addHeader(record, CoreHeaders.EVENT_ID, env.getEventId());
        addHeader(record, CoreHeaders.EVENT_TYPE, env.getEventType());
        addHeader(record, CoreHeaders.CORRELATION_ID, env.getCorrelationId());
        addHeader(record, CoreHeaders.CAUSATION_ID, env.getCausationId());
        addHeader(record, CoreHeaders.PRODUCER, env.getProducer());

        CompletableFuture<SendResult<String, Object>> out = new CompletableFuture<>();
        CompletableFuture<SendResult<String, Object>> sent;
        try {
            sent = connection.send(record);
        } catch (RuntimeException e) {
            out.completeExceptionally(failure(exchange, env, e));
            return out;
        }

        sent.whenComplete((res, ex) -> {
            if (ex == null) {
                out.complete(res);
            } else {
                out.completeExceptionally(failure(exchange, env, ex));
            }
        });
        return out;
    }

    private static SagaRetryableException failure(String exchange, EventEnvelope env, Throwable cause) {
        log.warn("Publish failed exchange={} eventType={} eventId={} corrId={}: {}",
                exchange, env.getEventType(), env.getEventId(), env.getCorrelationId(), cause.toString());
        return new SagaRetryableException("Publish of eventId=" + env.getEventId() + " to " + exchange + " failed", cause);
    }

    private static void addHeader(ProducerRecord<String, Object> record, String key, String value) {
        if (StringUtils.hasText(value)) {
            record.headers().add(new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8)));
        }
    }
}
