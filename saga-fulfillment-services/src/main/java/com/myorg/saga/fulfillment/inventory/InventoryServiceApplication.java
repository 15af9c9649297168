package com.myorg.saga.fulfillment.inventory;

import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import com.myorg.saga.fulfillment.common.ServiceClockConfiguration;
import com.myorg.saga.fulfillment.common.web.ApiExceptionHandler;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({ServiceClockConfiguration.class, FulfillmentEventEmitter.class, ApiExceptionHandler.class})
public class InventoryServiceApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(InventoryServiceApplication.class)
                .properties("spring.config.name=inventory-service")
                .run(args);
    }
}
