package com.myorg.saga.fulfillment.order;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepository {

    private final JdbcTemplate jdbc;

    public void insert(Order order) {
        String sql = """
                INSERT INTO orders (order_id, order_number, user_id, customer_name, customer_email, phone_number,
                                    total_amount, status, remarks, changed_by, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        jdbc.update(sql,
                order.getOrderId(),
                order.getOrderNumber(),
                order.getUserId(),
                order.getCustomerName(),
                order.getCustomerEmail(),
                order.getPhoneNumber(),
                order.getTotalAmount(),
                order.getStatus().name(),
                order.getRemarks(),
                order.getChangedBy(),
                Timestamp.from(order.getCreatedAt()),
                Timestamp.from(order.getUpdatedAt()));

        List<Object[]> lines = new ArrayList<>();
        for (int i = 0; i < order.getLines().size(); i++) {
            OrderLine l = order.getLines().get(i);
            lines.add(new Object[]{order.getOrderId(), i + 1, l.productId(), l.quantity(), l.unitPrice()});
        }
        jdbc.batchUpdate("""
                INSERT INTO order_line (order_id, line_no, product_id, quantity, unit_price)
                VALUES (?, ?, ?, ?, ?)
                """, lines);
    }

    public Optional<Order> findById(String orderId) {
        List<Order> orders = jdbc.query("""
                SELECT order_id, order_number, user_id, customer_name, customer_email, phone_number,
                       total_amount, status, remarks, changed_by, created_at, updated_at
                FROM orders
                WHERE order_id=?
                """, (rs, i) -> Order.builder()
                .orderId(rs.getString("order_id"))
                .orderNumber(rs.getString("order_number"))
                .userId(rs.getString("user_id"))
                .customerName(rs.getString("customer_name"))
                .customerEmail(rs.getString("customer_email"))
                .phoneNumber(rs.getString("phone_number"))
                .totalAmount(rs.getBigDecimal("total_amount"))
                .status(OrderStatus.valueOf(rs.getString("status")))
                .remarks(rs.getString("remarks"))
                .changedBy(rs.getString("changed_by"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build(), orderId);
        if (orders.isEmpty()) return Optional.empty();

        Order order = orders.get(0);
        order.setLines(jdbc.query("""
                SELECT product_id, quantity, unit_price
                FROM order_line
                WHERE order_id=?
                ORDER BY line_no
                """, (rs, i) -> new OrderLine(
                rs.getString("product_id"),
                rs.getInt("quantity"),
                rs.getBigDecimal("unit_price")), orderId));
        return Optional.of(order);
    }

    public Optional<OrderStatus> findStatus(String orderId) {
        List<String> rows = jdbc.queryForList("SELECT status FROM orders WHERE order_id=?", String.class, orderId);
        return rows.stream().findFirst().map(OrderStatus::valueOf);
    }

    /** Conditional on the status the caller read. @return rows updated, 0 when the status moved underneath */
    public int updateStatus(String orderId, OrderStatus expected, OrderStatus next,
                            String remarks, String changedBy, Instant now) {
        String sql = """
                UPDATE orders
                SET status=?, remarks=COALESCE(?, remarks), changed_by=?, updated_at=?
                WHERE order_id=? AND status=?
                """;
        return jdbc.update(sql, next.name(), remarks, changedBy, Timestamp.from(now), orderId, expected.name());
    }
}
