package com.myorg.saga.outbox.jdbc;

import java.util.List;

/** Test seams around a relay pass. */
public interface OutboxRelayHooks {

    default void afterClaim(List<OutboxRow> claimedRows) {}

    default void beforeSend(OutboxRow row) {}
}
