package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.notification.channel.ChannelSender;
import com.myorg.saga.fulfillment.notification.channel.ChannelSenderRegistry;
import com.myorg.saga.fulfillment.notification.channel.SendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Sends due notifications. Per notification: preference filter (defer or channel disabled),
 * retry cap, send, attempt log, status. One notification failing never stops the batch and
 * {@link #processBatch} never throws.
 *
 * <p>The provider call runs outside any transaction; recording the attempt and the new status
 * is one transaction. A fault while processing counts as a failed attempt, so the notification
 * stays due until the retry cap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    static final String CHANNEL_DISABLED = "channel disabled by user preference";
    static final String MAX_RETRIES_EXCEEDED = "max retries exceeded";
    static final String DEFERRED = "deferred by quiet hours / do-not-disturb";

    private enum Outcome { SENT, FAILED, DEFERRED }

    private final NotificationRepository notifications;
    private final UserPreferenceRepository preferences;
    private final ChannelSenderRegistry senders;
    private final NotificationProperties props;
    private final TransactionTemplate tx;
    private final Clock clock;

    public DispatchSummary processBatch(int take, int skip) {
        List<Notification> due;
        try {
            due = notifications.findDue(clock.instant(), props.getMaxRetries(), take, skip);
        } catch (RuntimeException e) {
            log.error("Could not load due notifications", e);
            return new DispatchSummary(0, 0, 0, 0);
        }
        if (due.isEmpty()) {
            log.debug("No notifications due");
            return new DispatchSummary(0, 0, 0, 0);
        }

        int sent = 0, failed = 0, deferred = 0;
        for (Notification n : due) {
            Outcome outcome;
            try {
                outcome = process(n);
            } catch (RuntimeException e) {
                log.error("Error processing notification {}", n.getId(), e);
                outcome = Outcome.FAILED;
                // counts toward the retry cap so the row stays due
                try {
                    notifications.markAttemptFailed(n.getId(), "processing error: " + e.getClass().getSimpleName(),
                            clock.instant());
                } catch (RuntimeException nested) {
                    log.error("Could not mark notification {} failed", n.getId(), nested);
                }
            }
            switch (outcome) {
                case SENT -> sent++;
                case FAILED -> failed++;
                case DEFERRED -> deferred++;
            }
        }
        log.info("Notification batch: fetched={} sent={} failed={} deferred={}", due.size(), sent, failed, deferred);
        return new DispatchSummary(due.size(), sent, failed, deferred);
    }

    private Outcome process(Notification n) {
        Instant now = clock.instant();
        Optional<UserPreference> pref = preferences.findByUserId(n.getUserId()).filter(UserPreference::isActive);

        if (pref.isPresent()) {
            Optional<Instant> deferUntil = deferUntil(pref.get(), now);
            if (deferUntil.isPresent()) {
                notifications.defer(n.getId(), deferUntil.get(), DEFERRED, now);
                log.info("Notification {} deferred until {}", n.getId(), deferUntil.get());
                return Outcome.DEFERRED;
            }
            if (!pref.get().isChannelEnabled(n.getChannel())) {
                notifications.markFailed(n.getId(), CHANNEL_DISABLED, now);
                log.info("Notification {} not sent: {} disabled for user {}", n.getId(), n.getChannel(), n.getUserId());
                return Outcome.FAILED;
            }
        }

        if (n.getRetryCount() >= props.getMaxRetries()) {
            notifications.markFailed(n.getId(), MAX_RETRIES_EXCEEDED, now);
            log.warn("Notification {} gave up after {} attempts", n.getId(), n.getRetryCount());
            return Outcome.FAILED;
        }

        SendResult result = send(n);
        Instant after = clock.instant();
        try {
            tx.executeWithoutResult(s -> {
                notifications.insertAttempt(n.getId(), n.getRetryCount() + 1, n.getChannel(),
                        result.success(), result.providerResponse(), result.error(), after);
                if (result.success()) {
                    notifications.markSent(n.getId(), after);
                } else {
                    notifications.markAttemptFailed(n.getId(), result.error(), after);
                }
            });
        } catch (RuntimeException e) {
            if (!result.success()) throw e;
            // the provider accepted it: a lost attempt row must not turn into a second send
            log.error("Could not record attempt of sent notification {}, marking it sent", n.getId(), e);
            notifications.markSent(n.getId(), after);
        }

        if (result.success()) {
            log.info("Notification {} sent via {}", n.getId(), n.getChannel());
            return Outcome.SENT;
        }
        log.warn("Notification {} attempt {} via {} failed: {}", n.getId(), n.getRetryCount() + 1,
                n.getChannel(), result.error());
        return Outcome.FAILED;
    }

    private SendResult send(Notification n) {
        ChannelSender sender = senders.forChannel(n.getChannel());
        try {
            SendResult result = sender.send(n);
            return result == null ? SendResult.failed("sender returned no result") : result;
        } catch (RuntimeException e) {
            log.warn("Sender for {} threw on notification {}", n.getChannel(), n.getId(), e);
            return SendResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Optional<Instant> deferUntil(UserPreference pref, Instant now) {
        if (pref.isDoNotDisturb()) {
            return Optional.of(now.plus(props.getDeferFallback()));
        }
        QuietHours quiet = pref.quietHours();
        ZoneId zone = props.zoneId();
        if (quiet.contains(now, zone)) {
            return Optional.of(quiet.nextEnd(now, zone));
        }
        return Optional.empty();
    }
}
