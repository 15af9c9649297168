package com.myorg.saga.fulfillment.notification.channel;

import com.myorg.saga.fulfillment.notification.NotificationChannel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Exactly one sender per channel, checked when the registry is built. */
public class ChannelSenderRegistry {

    private final Map<NotificationChannel, ChannelSender> senders;

    public ChannelSenderRegistry(List<ChannelSender> senders) {
        Map<NotificationChannel, ChannelSender> byChannel = new EnumMap<>(NotificationChannel.class);
        for (ChannelSender s : senders) {
            ChannelSender previous = byChannel.putIfAbsent(s.channel(), s);
            if (previous != null) {
                throw new IllegalStateException("Duplicate sender for channel " + s.channel() + ": "
                        + previous.getClass().getName() + " and " + s.getClass().getName());
            }
        }
        Set<NotificationChannel> missing = EnumSet.allOf(NotificationChannel.class);
        missing.removeAll(byChannel.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No sender for channel(s) " + missing);
        }
        this.senders = Collections.unmodifiableMap(byChannel);
    }

    public ChannelSender forChannel(NotificationChannel channel) {
        return senders.get(channel);
    }
}
