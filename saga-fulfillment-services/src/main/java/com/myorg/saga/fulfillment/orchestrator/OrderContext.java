package com.myorg.saga.fulfillment.orchestrator;

import com.myorg.saga.contracts.fulfillment.events.OrderLineItem;
import com.myorg.saga.contracts.fulfillment.events.OrderPlacedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/** What the orchestrator keeps from OrderPlaced to build the terminal events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderContext {
    private String orderNumber;
    private String userId;
    private String customerName;
    private String customerEmail;
    private String phoneNumber;
    private BigDecimal totalAmount;
    private List<OrderLineItem> items;

    public static OrderContext from(OrderPlacedEvent placed) {
        return OrderContext.builder()
                .orderNumber(placed.getOrderNumber())
                .userId(placed.getUserId())
                .customerName(placed.getCustomerName())
                .customerEmail(placed.getCustomerEmail())
                .phoneNumber(placed.getPhoneNumber())
                .totalAmount(placed.getTotalAmount())
                .items(placed.getItems() == null ? List.of() : List.copyOf(placed.getItems()))
                .build();
    }
}
