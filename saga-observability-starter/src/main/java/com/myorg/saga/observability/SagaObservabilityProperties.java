package com.myorg.saga.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "saga.observability")
public class SagaObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // low-cardinality tags only; eventId and corrId are never tags
    private boolean tagQueue = true;
    private boolean tagEventType = true;
    private boolean tagOutcome = true;
}
