package com.myorg.saga.fulfillment.order;

import com.myorg.saga.fulfillment.common.FulfillmentEventEmitter;
import com.myorg.saga.fulfillment.common.ServiceClockConfiguration;
import com.myorg.saga.fulfillment.common.web.ApiExceptionHandler;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({ServiceClockConfiguration.class, FulfillmentEventEmitter.class, ApiExceptionHandler.class})
public class OrderServiceApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(OrderServiceApplication.class)
                .properties("spring.config.name=order-service")
                .run(args);
    }
}
