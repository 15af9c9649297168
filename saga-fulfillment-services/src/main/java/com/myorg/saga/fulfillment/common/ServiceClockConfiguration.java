package com.myorg.saga.fulfillment.common;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ServiceClockConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
