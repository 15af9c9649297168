package com.myorg.saga.kafka.topology;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.errors.TopicExistsException;
import org.springframework.kafka.core.KafkaAdmin;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@Slf4j
public class KafkaTopologyAdmin implements TopologyAdmin {

    private final KafkaAdmin kafkaAdmin;
    private final Duration timeout;

    public KafkaTopologyAdmin(KafkaAdmin kafkaAdmin, Duration timeout) {
        this.kafkaAdmin = kafkaAdmin;
        this.timeout = timeout;
    }

    @Override
    public Map<String, TopicSpec> describe(Collection<String> names) {
        try (AdminClient client = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            Set<String> existing = client.listTopics().names().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            List<String> wanted = names.stream().filter(existing::contains).toList();
            if (wanted.isEmpty()) return Map.of();

            Map<String, TopicDescription> descriptions = client.describeTopics(wanted)
                    .allTopicNames()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);

            Map<String, TopicSpec> out = new HashMap<>();
            descriptions.forEach((name, d) -> {
                short replicas = d.partitions().isEmpty() ? 0 : (short) d.partitions().get(0).replicas().size();
                out.put(name, new TopicSpec(name, d.partitions().size(), replicas));
            });
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while describing topics " + names, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to describe topics " + names, e);
        }
    }

    @Override
    public void create(Collection<TopicSpec> topics) {
        if (topics.isEmpty()) return;
        List<NewTopic> newTopics = topics.stream()
                .map(t -> new NewTopic(t.name(), t.partitions(), t.replicas()))
                .toList();

        try (AdminClient client = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            client.createTopics(newTopics).all().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.info("Topic created concurrently by another instance: {}", e.getCause().getMessage());
                return;
            }
            throw new IllegalStateException("Failed to create topics " + topics, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while creating topics " + topics, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create topics " + topics, e);
        }
    }
}
