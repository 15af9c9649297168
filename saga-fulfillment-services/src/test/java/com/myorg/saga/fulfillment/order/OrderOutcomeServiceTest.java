package com.myorg.saga.fulfillment.order;

import com.myorg.saga.fulfillment.FulfillmentTestSupport;
import com.myorg.saga.fulfillment.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderOutcomeServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    private OrderRepository orders;
    private OrderOutcomeService outcomes;

    @BeforeEach
    void setUp() {
        orders = new OrderRepository(new JdbcTemplate(FulfillmentTestSupport.migratedDataSource("order")));
        outcomes = new OrderOutcomeService(orders, clock);
        orders.insert(Order.builder()
                .orderId("o-1")
                .orderNumber("ORD-20260301-00000001")
                .userId("u-1")
                .customerEmail("ada@example.com")
                .totalAmount(new BigDecimal("10.00"))
                .status(OrderStatus.PLACED)
                .changedBy("u-1")
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .lines(List.of(new OrderLine("P1", 1, new BigDecimal("10.00"))))
                .build());
    }

    @Test
    void cancel_compensatesPendingOrderAndRecordsReason() {
        assertThat(outcomes.markReservationPending("o-1")).isTrue();
        assertThat(outcomes.cancel("o-1", "insufficient stock")).isTrue();

        Order order = orders.findById("o-1").orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getRemarks()).isEqualTo("insufficient stock");
        assertThat(order.getChangedBy()).isEqualTo(OrderOutcomeService.ORCHESTRATOR_ACTOR);
    }

    @Test
    void repeatedCancel_isNoOp() {
        outcomes.cancel("o-1", "insufficient stock");
        clock.advance(Duration.ofMinutes(1));

        assertThat(outcomes.cancel("o-1", "something else")).isFalse();
        assertThat(orders.findById("o-1").orElseThrow().getRemarks()).isEqualTo("insufficient stock");
    }

    @Test
    void terminalOrderIgnoresLaterOutcomes() {
        outcomes.confirm("o-1");

        assertThat(outcomes.cancel("o-1", "late")).isFalse();
        assertThat(outcomes.markReservationPending("o-1")).isFalse();
        assertThat(orders.findStatus("o-1")).contains(OrderStatus.CONFIRMED);
    }

    @Test
    void reservationRequestAfterConfirmation_doesNotMoveBack() {
        outcomes.markReservationPending("o-1");
        outcomes.confirm("o-1");

        assertThat(outcomes.markReservationPending("o-1")).isFalse();
        assertThat(orders.findStatus("o-1")).contains(OrderStatus.CONFIRMED);
    }

    @Test
    void unknownOrder_throwsSoTheMessageIsRedelivered() {
        assertThatThrownBy(() -> outcomes.confirm("missing")).isInstanceOf(OrderNotFoundException.class);
    }
}
