package com.myorg.saga.kafka;

import com.myorg.saga.contracts.core.exception.SagaNonRetryableException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.errors.SerializationException;
import org.springframework.kafka.support.serializer.DeserializationException;

// Unreadable payloads and SagaNonRetryableException skip redelivery; everything else exhausted its retries.
public class DefaultSagaDlqReasonClassifier implements SagaDlqReasonClassifier {

    @Override
    public Decision classify(ConsumerRecord<?, ?> record, Exception ex) {
        if (findCause(ex, DeserializationException.class) != null
                || findCause(ex, SerializationException.class) != null) {
            return new Decision(SagaDlqReason.DESERIALIZATION.code(), true);
        }

        SagaNonRetryableException nre = findCause(ex, SagaNonRetryableException.class);
        if (nre != null) {
            return new Decision(nre.getReason(), true);
        }

        return new Decision(SagaDlqReason.RETRY_EXHAUSTED.code(), false);
    }

    // listener exceptions wrap the real failure, so look through the whole chain
    private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        Throwable t = ex;
        while (t != null) {
            if (type.isInstance(t)) return type.cast(t);
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return null;
    }
}
