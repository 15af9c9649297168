package com.myorg.saga.kafka.topology;

import java.util.Collection;
import java.util.Map;

/**
 * Broker-side view used by {@link TopologyManager}.
 */
public interface TopologyAdmin {

    /** Existing topics among {@code names}, keyed by name. Missing topics are absent from the map. */
    Map<String, TopicSpec> describe(Collection<String> names);

    /** Create topics; a topic that appeared concurrently is not an error. */
    void create(Collection<TopicSpec> topics);
}
