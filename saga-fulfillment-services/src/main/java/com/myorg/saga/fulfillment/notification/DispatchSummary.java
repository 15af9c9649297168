package com.myorg.saga.fulfillment.notification;

/** Counts of one dispatcher pass. */
public record DispatchSummary(int fetched, int sent, int failed, int deferred) {
}
