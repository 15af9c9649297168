package com.myorg.saga.fulfillment.orchestrator;

import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import com.myorg.saga.fulfillment.common.ServiceClockConfiguration;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({ServiceClockConfiguration.class, FulfillmentEventEmitter.class})
public class OrchestratorServiceApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(OrchestratorServiceApplication.class)
                .properties("spring.config.name=orchestrator-service")
                .run(args);
    }
}
