package com.myorg.saga.kafka.topology;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares exchanges and one dead-letter topic per queue before any consumer starts.
 *
 * <p>Re-running against an existing, identical topology is a no-op. A topic that exists with a
 * different partition count or replication factor aborts startup with
 * {@link TopologyConflictException}.
 */
@Slf4j
public class TopologyManager implements SmartLifecycle {

    public static final int PHASE = Integer.MIN_VALUE + 100;

    private final TopologyProperties props;
    private final TopologyAdmin admin;
    private final String dlqSuffix;
    private volatile boolean running;

    public TopologyManager(TopologyProperties props, TopologyAdmin admin, String dlqSuffix) {
        this.props = props;
        this.admin = admin;
        this.dlqSuffix = dlqSuffix;
    }

    /**
     * @return topics created by this call
     */
    public List<TopicSpec> declare() {
        props.validate();

        Map<String, TopicSpec> desired = desiredTopics();
        Map<String, TopicSpec> existing = admin.describe(desired.keySet());

        List<TopicSpec> missing = new ArrayList<>();
        for (TopicSpec want : desired.values()) {
            TopicSpec have = existing.get(want.name());
            if (have == null) {
                missing.add(want);
                continue;
            }
            if (have.partitions() != want.partitions() || have.replicas() != want.replicas()) {
                throw new TopologyConflictException("Topic " + want.name() + " exists with partitions=" + have.partitions()
                        + " replicas=" + have.replicas() + " but partitions=" + want.partitions()
                        + " replicas=" + want.replicas() + " is declared");
            }
        }

        if (!missing.isEmpty()) {
            admin.create(missing);
            log.info("Declared topics {}", missing.stream().map(TopicSpec::name).toList());
        } else {
            log.info("Topology up to date ({} topics)", desired.size());
        }
        return missing;
    }

    Map<String, TopicSpec> desiredTopics() {
        Map<String, TopicSpec> out = new LinkedHashMap<>();
        for (TopologyProperties.Exchange e : props.getExchanges()) {
            out.put(e.getName(), new TopicSpec(e.getName(), e.getPartitions(), e.getReplicas()));
        }
        for (TopologyProperties.Queue q : props.getQueues()) {
            TopologyProperties.Exchange e = props.exchange(q.getExchange()).orElseThrow();
            String dlq = q.getName() + dlqSuffix;
            out.put(dlq, new TopicSpec(dlq, e.getPartitions(), e.getReplicas()));
        }
        return out;
    }

    @Override
    public void start() {
        if (props.isDeclareOnStartup()) {
            declare();
        } else {
            props.validate();
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
