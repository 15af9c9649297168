package com.myorg.saga.kafka.topology;

public class TopologyConflictException extends RuntimeException {
    public TopologyConflictException(String message) {
        super(message);
    }
}
