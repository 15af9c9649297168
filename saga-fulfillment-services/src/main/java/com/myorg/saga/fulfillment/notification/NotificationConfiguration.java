package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.notification.channel.ChannelSender;
import com.myorg.saga.fulfillment.notification.channel.ChannelSenderRegistry;
import com.myorg.saga.fulfillment.notification.channel.LoggingChannelSender;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.List;

@Configuration(proxyBeanMethods = false)
@EnableScheduling
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfiguration {

    @Bean
    public ChannelSender emailSender() {
        return new LoggingChannelSender(NotificationChannel.EMAIL);
    }

    @Bean
    public ChannelSender smsSender() {
        return new LoggingChannelSender(NotificationChannel.SMS);
    }

    @Bean
    public ChannelSender inAppSender() {
        return new LoggingChannelSender(NotificationChannel.IN_APP);
    }

    @Bean
    public ChannelSenderRegistry channelSenderRegistry(List<ChannelSender> senders) {
        return new ChannelSenderRegistry(senders);
    }

    @Bean(name = "notificationSchedule")
    public NotificationScheduleValues notificationSchedule(NotificationProperties props) {
        return new NotificationScheduleValues(props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "saga.notification.dispatcher", name = "enabled", havingValue = "true", matchIfMissing = true)
    public NotificationScheduler notificationScheduler(NotificationDispatcher dispatcher, NotificationProperties props) {
        return new NotificationScheduler(dispatcher, props);
    }
}
