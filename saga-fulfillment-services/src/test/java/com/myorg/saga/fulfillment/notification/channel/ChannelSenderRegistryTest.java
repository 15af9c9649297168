package com.myorg.saga.fulfillment.notification.channel;

import com.myorg.saga.fulfillment.notification.Notification;
import com.myorg.saga.fulfillment.notification.NotificationChannel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelSenderRegistryTest {

    @Test
    void resolvesOneSenderPerChannel() {
        LoggingChannelSender email = new LoggingChannelSender(NotificationChannel.EMAIL);
        ChannelSenderRegistry registry = new ChannelSenderRegistry(List.of(
                email,
                new LoggingChannelSender(NotificationChannel.SMS),
                new LoggingChannelSender(NotificationChannel.IN_APP)));

        assertThat(registry.forChannel(NotificationChannel.EMAIL)).isSameAs(email);
    }

    @Test
    void missingChannelFailsAtConstruction() {
        assertThatThrownBy(() -> new ChannelSenderRegistry(List.of(new LoggingChannelSender(NotificationChannel.EMAIL))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SMS")
                .hasMessageContaining("IN_APP");
    }

    @Test
    void duplicateChannelFailsAtConstruction() {
        assertThatThrownBy(() -> new ChannelSenderRegistry(List.of(
                new LoggingChannelSender(NotificationChannel.EMAIL),
                new LoggingChannelSender(NotificationChannel.EMAIL),
                new LoggingChannelSender(NotificationChannel.SMS),
                new LoggingChannelSender(NotificationChannel.IN_APP))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate sender for channel EMAIL");
    }

    @Test
    void loggingSenderFailsWithoutRecipient() {
        LoggingChannelSender sms = new LoggingChannelSender(NotificationChannel.SMS);

        SendResult missing = sms.send(Notification.builder().id("n-1").userId("u-1").build());
        SendResult ok = sms.send(Notification.builder().id("n-2").userId("u-1").recipientPhone("+15550100").build());

        assertThat(missing.success()).isFalse();
        assertThat(missing.error()).isEqualTo("no SMS recipient");
        assertThat(ok.success()).isTrue();
        assertThat(ok.providerResponse()).isEqualTo("logged:SMS:n-2");
    }
}
