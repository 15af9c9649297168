package com.myorg.saga.kafka.topology;

public record TopicSpec(String name, int partitions, short replicas) {}
