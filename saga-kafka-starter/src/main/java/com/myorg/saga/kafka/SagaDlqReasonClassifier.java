package com.myorg.saga.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;

// decides which reason is stamped on a dead-lettered record
public interface SagaDlqReasonClassifier {

    record Decision(String reason, boolean nonRetryable) {}

    Decision classify(ConsumerRecord<?, ?> record, Exception ex);
}
