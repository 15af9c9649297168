package com.myorg.saga.kafka.topology;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologyManagerTest {

    private static TopologyProperties fulfillmentTopology() {
        TopologyProperties props = new TopologyProperties();

        TopologyProperties.Exchange order = new TopologyProperties.Exchange();
        order.setName("fulfillment.order");
        order.setPartitions(6);
        TopologyProperties.Exchange stock = new TopologyProperties.Exchange();
        stock.setName("fulfillment.stock");
        stock.setPartitions(3);
        props.setExchanges(List.of(order, stock));

        TopologyProperties.Queue placed = new TopologyProperties.Queue();
        placed.setName("orchestrator.order-placed");
        placed.setExchange("fulfillment.order");
        placed.setRoutingKeys(List.of("order.placed"));
        TopologyProperties.Queue outcomes = new TopologyProperties.Queue();
        outcomes.setName("orchestrator.stock-outcomes");
        outcomes.setExchange("fulfillment.stock");
        outcomes.setRoutingKeys(List.of("stock.reserved", "stock.reservation.failed"));
        props.setQueues(List.of(placed, outcomes));
        return props;
    }

    @Test
    void declaresExchangesAndOneDeadLetterTopicPerQueue() {
        InMemoryTopologyAdmin admin = new InMemoryTopologyAdmin();
        TopologyManager manager = new TopologyManager(fulfillmentTopology(), admin, ".DLQ");

        manager.declare();

        assertThat(admin.topics).containsOnlyKeys(
                "fulfillment.order", "fulfillment.stock",
                "orchestrator.order-placed.DLQ", "orchestrator.stock-outcomes.DLQ");
        // DLQ inherits the partition count of the bound exchange
        assertThat(admin.topics.get("orchestrator.order-placed.DLQ").partitions()).isEqualTo(6);
        assertThat(admin.topics.get("orchestrator.stock-outcomes.DLQ").partitions()).isEqualTo(3);
    }

    @Test
    void redeclaringIdenticalTopologyIsNoOp() {
        InMemoryTopologyAdmin admin = new InMemoryTopologyAdmin();
        TopologyManager manager = new TopologyManager(fulfillmentTopology(), admin, ".DLQ");

        manager.declare();
        List<TopicSpec> createdSecondTime = manager.declare();

        assertThat(createdSecondTime).isEmpty();
        assertThat(admin.createCalls).isEqualTo(1);
    }

    @Test
    void onlyMissingTopicsAreCreated() {
        InMemoryTopologyAdmin admin = new InMemoryTopologyAdmin();
        admin.topics.put("fulfillment.order", new TopicSpec("fulfillment.order", 6, (short) 1));

        List<TopicSpec> created = new TopologyManager(fulfillmentTopology(), admin, ".DLQ").declare();

        assertThat(created).extracting(TopicSpec::name).doesNotContain("fulfillment.order");
        assertThat(created).hasSize(3);
    }

    @Test
    void conflictingPartitionCountIsFatal() {
        InMemoryTopologyAdmin admin = new InMemoryTopologyAdmin();
        admin.topics.put("fulfillment.stock", new TopicSpec("fulfillment.stock", 12, (short) 1));
        TopologyManager manager = new TopologyManager(fulfillmentTopology(), admin, ".DLQ");

        assertThatThrownBy(manager::start)
                .isInstanceOf(TopologyConflictException.class)
                .hasMessageContaining("fulfillment.stock");
        assertThat(manager.isRunning()).isFalse();
        assertThat(admin.createCalls).isZero();
    }

    @Test
    void queueBoundToUndeclaredExchangeIsRejected() {
        TopologyProperties props = fulfillmentTopology();
        props.getQueues().get(0).setExchange("fulfillment.payment");

        assertThatThrownBy(() -> new TopologyManager(props, new InMemoryTopologyAdmin(), ".DLQ").declare())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fulfillment.payment");
    }

    @Test
    void queueWithoutRoutingKeysIsRejected() {
        TopologyProperties props = fulfillmentTopology();
        props.getQueues().get(1).setRoutingKeys(List.of());

        assertThatThrownBy(props::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no routing keys");
    }

    @Test
    void startupDeclarationCanBeSwitchedOff() {
        TopologyProperties props = fulfillmentTopology();
        props.setDeclareOnStartup(false);
        InMemoryTopologyAdmin admin = new InMemoryTopologyAdmin();
        TopologyManager manager = new TopologyManager(props, admin, ".DLQ");

        manager.start();

        assertThat(manager.isRunning()).isTrue();
        assertThat(admin.topics).isEmpty();
    }
}
