package com.myorg.saga.contracts.fulfillment.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineItem {
    private String productId;
    private int quantity;
    private BigDecimal unitPrice;
}
