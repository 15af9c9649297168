package com.myorg.saga.kafka;

import com.myorg.saga.kafka.topology.KafkaTopologyAdmin;
import com.myorg.saga.kafka.topology.TopologyAdmin;
import com.myorg.saga.kafka.topology.TopologyManager;
import com.myorg.saga.kafka.topology.TopologyProperties;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@EnableConfigurationProperties({SagaKafkaProperties.class, TopologyProperties.class})
public class SagaKafkaAutoConfiguration {

    /**
     * KafkaAdmin wired to saga.kafka.bootstrap-servers.
     * (Spring Boot's default one reads spring.kafka.bootstrap-servers, which we don't use.)
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(SagaKafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        return new KafkaAdmin(cfg);
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyAdmin topologyAdmin(KafkaAdmin kafkaAdmin, TopologyProperties topology) {
        return new KafkaTopologyAdmin(kafkaAdmin, topology.getAdminTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyManager topologyManager(TopologyProperties topology, TopologyAdmin admin, SagaKafkaProperties props) {
        return new TopologyManager(topology, admin, props.getDlq().getSuffix());
    }
}
