package com.myorg.saga.contracts.fulfillment.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCancelledEvent {
    public static final String DEFAULT_REASON = "stock reservation failed";

    private String orderId;
    private String orderNumber;
    private String userId;
    private String customerName;
    private String customerEmail;
    private String phoneNumber;
    private BigDecimal totalAmount;
    private List<OrderLineItem> items;
    private String reason;
}
