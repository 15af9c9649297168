package com.myorg.saga.fulfillment.inventory;

import java.time.Instant;

public record Product(String productId, String name, int stock, Instant updatedAt) {}
