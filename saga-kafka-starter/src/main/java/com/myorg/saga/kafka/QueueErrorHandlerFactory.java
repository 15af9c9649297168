package com.myorg.saga.kafka;

import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.util.backoff.FixedBackOff;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Builds the error handler of one queue: a bounded number of redeliveries with a fixed
 * back-off, then the record goes to {@code <queue><suffix>}. Non-retryable failures skip
 * the redeliveries.
 */
@Slf4j
public class QueueErrorHandlerFactory {

    private final SagaKafkaProperties props;
    private final KafkaOperations<String, Object> dlqTemplate;
    private final SagaDlqReasonClassifier classifier;
    private final String service;
    private final ObjectProvider<MeterRegistry> registryProvider;
    private final Clock clock;

    public QueueErrorHandlerFactory(SagaKafkaProperties props,
                                    KafkaOperations<String, Object> dlqTemplate,
                                    SagaDlqReasonClassifier classifier,
                                    String service,
                                    ObjectProvider<MeterRegistry> registryProvider,
                                    Clock clock) {
        this.props = props;
        this.dlqTemplate = dlqTemplate;
        this.classifier = classifier;
        this.service = service;
        this.registryProvider = registryProvider;
        this.clock = clock;
    }

    public DefaultErrorHandler forQueue(String queue) {
        long interval = props.getConsumer().getRetry().getBackoff().toMillis();
        long attempts = props.getConsumer().getRetry().getAttempts();
        FixedBackOff backOff = new FixedBackOff(interval, attempts);

        DefaultErrorHandler handler;
        if (props.getDlq().isEnabled()) {
            handler = new DefaultErrorHandler(deadLetterRecoverer(queue), backOff);
        } else {
            log.warn("Dead-lettering disabled: records of queue={} are dropped after {} redeliveries", queue, attempts);
            handler = new DefaultErrorHandler(backOff);
        }

        handler.setCommitRecovered(true);
        handler.addNotRetryableExceptions(
                SerializationException.class,
                DeserializationException.class,
                SagaNonRetryableException.class
        );
        handler.setRetryListeners(new RetryDlqMetricsListener(service, queue, registryProvider));
        return handler;
    }

    // first delivery plus the redeliveries
    long maxDeliveries() {
        return props.getConsumer().getRetry().getAttempts() + 1L;
    }

    public String dlqTopic(String queue) {
        return queue + props.getDlq().getSuffix();
    }

    DeadLetterPublishingRecoverer deadLetterRecoverer(String queue) {
        String dlq = dlqTopic(queue);
        // negative partition: let the producer pick, the DLQ may have fewer partitions than the exchange
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                dlqTemplate,
                (rec, ex) -> new TopicPartition(dlq, -1)
        );
        recoverer.setHeadersFunction((rec, ex) -> dlqHeaders(queue, rec, ex));
        return recoverer;
    }

    Headers dlqHeaders(String queue, ConsumerRecord<?, ?> rec, Exception ex) {
        RecordHeaders headers = new RecordHeaders();
        SagaDlqReasonClassifier.Decision decision = classifier.classify(rec, ex);
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);

        putHeader(headers, SagaDlqHeaders.REASON, decision.reason());
        putHeader(headers, SagaDlqHeaders.NON_RETRYABLE, String.valueOf(decision.nonRetryable()));
        putHeader(headers, SagaDlqHeaders.ATTEMPTS, String.valueOf(decision.nonRetryable() ? 1 : maxDeliveries()));
        putHeader(headers, SagaDlqHeaders.CORRELATION_ID, rec.key() == null ? null : rec.key().toString());
        putHeader(headers, SagaDlqHeaders.EXCEPTION_CLASS, root.getClass().getName());
        putHeader(headers, SagaDlqHeaders.EXCEPTION_MESSAGE, safeMsg(root.getMessage(), 512));
        putHeader(headers, SagaDlqHeaders.QUEUE, queue);
        putHeader(headers, SagaDlqHeaders.SERVICE, service);
        putHeader(headers, SagaDlqHeaders.TS_MS, String.valueOf(clock.millis()));
        return headers;
    }

    private static void putHeader(Headers headers, String key, String value) {
        if (value == null) value = "";
        headers.remove(key);
        headers.add(key, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String safeMsg(String msg, int maxLen) {
        if (msg == null) return "";
        return msg.length() <= maxLen ? msg : msg.substring(0, maxLen);
    }
}
