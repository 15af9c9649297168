package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.common.ServiceClockConfiguration;
import com.myorg.saga.fulfillment.common.web.ApiExceptionHandler;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.annotation.Import;

/** Consumes terminal saga events only; emits nothing, so it carries no outbox. */
@SpringBootApplication
@Import({ServiceClockConfiguration.class, ApiExceptionHandler.class})
public class NotificationServiceApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(NotificationServiceApplication.class)
                .properties("spring.config.name=notification-service")
                .run(args);
    }
}
