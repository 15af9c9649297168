package com.myorg.saga.fulfillment.notification.channel;

import com.myorg.saga.fulfillment.notification.Notification;
import com.myorg.saga.fulfillment.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Writes the message to the log instead of calling a provider. Still checks the recipient the
 * channel needs, so a notification without one fails like it would against a real gateway.
 */
@Slf4j
public class LoggingChannelSender implements ChannelSender {

    private final NotificationChannel channel;

    public LoggingChannelSender(NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public SendResult send(Notification n) {
        String recipient = switch (channel) {
            case EMAIL -> n.getRecipientEmail();
            case SMS -> n.getRecipientPhone();
            case IN_APP -> n.getUserId();
        };
        if (!StringUtils.hasText(recipient)) {
            return SendResult.failed("no " + channel + " recipient");
        }
        log.info("[{}] to={} subject='{}' notificationId={}", channel, recipient, n.getSubject(), n.getId());
        return SendResult.sent("logged:" + channel + ":" + n.getId());
    }
}
