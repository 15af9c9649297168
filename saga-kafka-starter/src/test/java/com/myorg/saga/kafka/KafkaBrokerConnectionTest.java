package com.myorg.saga.kafka;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.SendResult;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaBrokerConnectionTest {

    private RecordingProducerFactory factory;
    private KafkaBrokerConnection connection;

    @BeforeEach
    void setUp() {
        factory = new RecordingProducerFactory();
        connection = new KafkaBrokerConnection(factory, new KafkaTemplate<>(factory));
    }

    @Test
    void sendBeforeStartIsRejected() {
        assertThatThrownBy(() -> connection.send(record()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fulfillment.order");
    }

    @Test
    void successfulSendDoesNotReconnect() {
        factory.autoComplete = true;
        connection.start();

        CompletableFuture<SendResult<String, Object>> f = connection.send(record());

        assertThat(f).isCompleted();
        assertThat(factory.last.history()).hasSize(1);
        assertThat(connection.reconnectCount()).isZero();
        assertThat(factory.resets).isZero();
    }

    @Test
    void transientFailureResetsProducer() {
        connection.start();

        CompletableFuture<SendResult<String, Object>> f = connection.send(record());
        factory.last.errorNext(new TimeoutException("broker not reachable"));

        assertThat(f).isCompletedExceptionally();
        assertThat(connection.reconnectCount()).isEqualTo(1);
        assertThat(factory.resets).isEqualTo(1);
    }

    @Test
    void permanentFailureKeepsProducer() {
        connection.start();

        CompletableFuture<SendResult<String, Object>> f = connection.send(record());
        factory.last.errorNext(new RecordTooLargeException("too big"));

        assertThat(f).isCompletedExceptionally();
        assertThat(connection.reconnectCount()).isZero();
        assertThat(factory.resets).isZero();
    }

    @Test
    void stopClosesProducerAndRejectsFurtherSends() {
        connection.start();
        connection.stop();

        assertThat(connection.isRunning()).isFalse();
        assertThat(factory.resets).isEqualTo(1);
        assertThatThrownBy(() -> connection.send(record())).isInstanceOf(IllegalStateException.class);
    }

    private static ProducerRecord<String, Object> record() {
        return new ProducerRecord<>("fulfillment.order", "order-1", Map.of("orderId", "order-1"));
    }

    // KafkaTemplate closes the producer after each send, so hand out a fresh MockProducer every time
    static class RecordingProducerFactory implements ProducerFactory<String, Object> {

        boolean autoComplete;
        MockProducer<String, Object> last;
        int resets;

        @Override
        public Producer<String, Object> createProducer() {
            last = new MockProducer<>(autoComplete, new StringSerializer(), new JsonSerializer<>());
            return last;
        }

        @Override
        public void reset() {
            resets++;
        }
    }
}
