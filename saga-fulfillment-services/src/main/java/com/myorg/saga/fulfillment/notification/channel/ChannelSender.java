package com.myorg.saga.fulfillment.notification.channel;

import com.myorg.saga.fulfillment.notification.Notification;
import com.myorg.saga.fulfillment.notification.NotificationChannel;

public interface ChannelSender {

    NotificationChannel channel();

    /** May throw; the dispatcher records a throw as a failed attempt. */
    SendResult send(Notification notification);
}
