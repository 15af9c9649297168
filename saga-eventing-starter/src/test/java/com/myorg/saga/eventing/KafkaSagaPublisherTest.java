package com.myorg.saga.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.contracts.core.conventions.CoreHeaders;
import com.myorg.saga.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.core.exception.SagaRetryableException;
import com.myorg.saga.kafka.KafkaBrokerConnection;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaSagaPublisherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockProducers producers;
    private KafkaBrokerConnection connection;
    private KafkaSagaPublisher publisher;

    @BeforeEach
    void setUp() {
        producers = new MockProducers();
        connection = new KafkaBrokerConnection(producers, new KafkaTemplate<>(producers));
        connection.start();
        publisher = new KafkaSagaPublisher(connection, mapper, "order-service");
    }

    @Test
    void recordIsKeyedByCorrelationIdAndCarriesHeaders() throws Exception {
        publisher.publish("fulfillment.order", "order.placed", "order-42", Map.of("orderId", "order-42")).get();

        ProducerRecord<String, Object> rec = producers.history().get(0);
        assertThat(rec.topic()).isEqualTo("fulfillment.order");
        assertThat(rec.key()).isEqualTo("order-42");

        EventEnvelope env = (EventEnvelope) rec.value();
        assertThat(env.getEventType()).isEqualTo("order.placed");
        assertThat(env.getCorrelationId()).isEqualTo("order-42");
        assertThat(env.getProducer()).isEqualTo("order-service");
        assertThat(env.getCausationId()).isNull();

        assertThat(header(rec, CoreHeaders.EVENT_TYPE)).isEqualTo("order.placed");
        assertThat(header(rec, CoreHeaders.CORRELATION_ID)).isEqualTo("order-42");
        assertThat(header(rec, CoreHeaders.EVENT_ID)).isEqualTo(env.getEventId());
        assertThat(rec.headers().lastHeader(CoreHeaders.CAUSATION_ID)).isNull();
    }

    @Test
    void derivedEnvelopeKeepsCorrelationAndCausation() throws Exception {
        EventEnvelope placed = EnvelopeBuilder.wrap(mapper, "order.placed", 1, "order-1", "order-1", null, "order-service", Map.of());
        EventEnvelope requested = EnvelopeBuilder.derive(mapper, placed, "stock.reservation.requested", "orchestrator", Map.of());

        publisher.publish("fulfillment.stock", requested).get();

        ProducerRecord<String, Object> rec = producers.history().get(0);
        assertThat(rec.key()).isEqualTo("order-1");
        assertThat(header(rec, CoreHeaders.CAUSATION_ID)).isEqualTo(placed.getEventId());
    }

    @Test
    void brokerFailureSurfacesAsRetryable() {
        producers.autoComplete = false;

        CompletableFuture<?> f = publisher.publish("fulfillment.order", "order.placed", "order-5", Map.of());
        producers.last.errorNext(new TimeoutException("broker gone"));

        assertThatThrownBy(f::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(SagaRetryableException.class);
        assertThat(connection.reconnectCount()).isEqualTo(1);
    }

    @Test
    void stoppedConnectionSurfacesAsRetryable() {
        connection.stop();

        CompletableFuture<?> f = publisher.publish("fulfillment.order", "order.placed", "order-6", Map.of());

        assertThat(f).isCompletedExceptionally();
        assertThatThrownBy(f::get).hasCauseInstanceOf(SagaRetryableException.class);
    }

    @Test
    void envelopeWithoutCorrelationIsRejected() {
        EventEnvelope env = EnvelopeBuilder.wrap(mapper, "order.placed", 1, "o", null, null, "order-service", Map.of());

        assertThatThrownBy(() -> publisher.publish("fulfillment.order", env))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String header(ProducerRecord<String, Object> rec, String key) {
        return new String(rec.headers().lastHeader(key).value(), StandardCharsets.UTF_8);
    }

    // KafkaTemplate closes the producer after each send, so every send gets a fresh MockProducer
    static class MockProducers implements ProducerFactory<String, Object> {

        boolean autoComplete = true;
        MockProducer<String, Object> last;
        final List<MockProducer<String, Object>> all = new ArrayList<>();

        @Override
        public Producer<String, Object> createProducer() {
            last = new MockProducer<>(autoComplete, new StringSerializer(), new JsonSerializer<>());
            all.add(last);
            return last;
        }

        @Override
        public void reset() {
        }

        List<ProducerRecord<String, Object>> history() {
            List<ProducerRecord<String, Object>> out = new ArrayList<>();
            all.forEach(p -> out.addAll(p.history()));
            return out;
        }
    }
}
