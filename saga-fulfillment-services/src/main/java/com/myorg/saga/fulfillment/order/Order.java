package com.myorg.saga.fulfillment.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    private String orderId;
    private String orderNumber;
    private String userId;
    private String customerName;
    private String customerEmail;
    private String phoneNumber;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private String remarks;
    private String changedBy;
    private Instant createdAt;
    private Instant updatedAt;
    private List<OrderLine> lines;
}
