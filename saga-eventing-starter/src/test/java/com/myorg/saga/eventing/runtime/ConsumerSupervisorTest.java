package com.myorg.saga.eventing.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.saga.eventing.JacksonPayloadConverter;
import com.myorg.saga.kafka.DefaultSagaDlqReasonClassifier;
import com.myorg.saga.kafka.QueueErrorHandlerFactory;
import com.myorg.saga.kafka.SagaKafkaProperties;
import com.myorg.saga.kafka.topology.TopologyProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsumerSupervisorTest {

    @Test
    void eachQueueGetsItsOwnGroupTopicAndErrorHandler() {
        SagaKafkaProperties kafkaProps = new SagaKafkaProperties();
        kafkaProps.getDlq().setEnabled(false);
        QueueErrorHandlerFactory errorHandlers = new QueueErrorHandlerFactory(kafkaProps, null,
                new DefaultSagaDlqReasonClassifier(), "notification-service",
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class), Clock.systemUTC());

        // containers are only built, never started: no broker needed
        DefaultKafkaConsumerFactory<String, Object> cf = new DefaultKafkaConsumerFactory<>(Map.of(
                ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, "localhost:9092",
                ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
                ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class));

        TopologyProperties topology = new TopologyProperties();
        TopologyProperties.Queue q = new TopologyProperties.Queue();
        q.setName("notification.saga-outcomes");
        q.setExchange("fulfillment.order");
        q.setRoutingKeys(List.of("order.confirmed", "order.cancelled"));
        q.setConcurrency(2);
        topology.setQueues(List.of(q));

        ConsumerSupervisor supervisor = new ConsumerSupervisor(cf, topology, errorHandlers, env -> { },
                new JacksonPayloadConverter(new ObjectMapper()), new NoopUnitOfWorkFactory(), Duration.ZERO,
                "notification-service");

        ConcurrentMessageListenerContainer<String, Object> c = supervisor.createContainer(q);

        ContainerProperties cp = c.getContainerProperties();
        assertThat(cp.getTopics()).containsExactly("fulfillment.order");
        assertThat(cp.getGroupId()).isEqualTo("notification.saga-outcomes");
        assertThat(cp.getAckMode()).isEqualTo(ContainerProperties.AckMode.RECORD);
        assertThat(cp.getMessageListener()).isInstanceOf(QueueWorker.class);
        assertThat(((QueueWorker) cp.getMessageListener()).queueName()).isEqualTo("notification.saga-outcomes");
        assertThat(c.getConcurrency()).isEqualTo(2);
        assertThat(c.getCommonErrorHandler()).isNotNull();
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.getPhase()).isGreaterThan(0);
    }
}
