package com.myorg.saga.contracts.fulfillment.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedLineItem {
    private String productId;
    private int requested;
    private int available;
    private String reason;
}
