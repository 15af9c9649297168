package com.myorg.saga.fulfillment.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Creation, listing, soft-disable and preferences. Sending belongs to {@link NotificationDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final int MAX_PAGE = 200;

    private final NotificationRepository notifications;
    private final UserPreferenceRepository preferences;
    private final NotificationProperties props;
    private final Clock clock;

    /**
     * Stores a PENDING notification. With a correlation id the call is idempotent per
     * (correlation id, type, channel) and a repeat returns the row already stored.
     *
     * @throws NotificationValidationException on a broken request or when the user's daily cap is reached
     */
    public Notification create(CreateNotificationRequest request) {
        validate(request);

        String dedupKey = dedupKey(request);
        if (dedupKey != null) {
            Optional<Notification> existing = notifications.findByDedupKey(dedupKey);
            if (existing.isPresent()) {
                log.info("Notification {} already recorded as {}", dedupKey, existing.get().getId());
                return existing.get();
            }
        }

        Instant now = clock.instant();
        checkDailyCap(request.getUserId(), now);

        Notification n = Notification.builder()
                .id(UUID.randomUUID().toString())
                .userId(request.getUserId())
                .channel(request.getChannel())
                .type(request.getType())
                .priority(request.getPriority() == null ? NotificationPriority.NORMAL : request.getPriority())
                .subject(StringUtils.hasText(request.getSubject())
                        ? request.getSubject()
                        : NotificationTemplates.subject(request.getType(), request.getTemplateData()))
                .content(StringUtils.hasText(request.getContent())
                        ? request.getContent()
                        : NotificationTemplates.content(request.getType(), request.getTemplateData()))
                .recipientEmail(firstNonBlank(request, CreateNotificationRequest.Recipient::getEmail))
                .recipientPhone(firstNonBlank(request, CreateNotificationRequest.Recipient::getPhoneNumber))
                .correlationId(request.getCorrelationId())
                .dedupKey(dedupKey)
                .status(NotificationStatus.PENDING)
                .retryCount(0)
                .scheduledAt(request.getScheduledAt())
                .active(true)
                .createdBy(StringUtils.hasText(request.getCreatedBy()) ? request.getCreatedBy() : "system")
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            notifications.insert(n);
        } catch (DuplicateKeyException e) {
            // concurrent delivery of the same saga event won the insert
            log.info("Notification {} recorded concurrently", dedupKey);
            return notifications.findByDedupKey(dedupKey).orElseThrow(() -> e);
        }
        log.info("Notification {} created for user {} channel={} type={}", n.getId(), n.getUserId(),
                n.getChannel(), n.getType());
        return n;
    }

    public List<Notification> listByUser(String userId, int take, int skip) {
        return notifications.findByUser(userId, boundedTake(take, skip), skip);
    }

    /** Page size capped at {@link #MAX_PAGE}; rejects a non-positive take or a negative skip. */
    static int boundedTake(int take, int skip) {
        if (take < 1 || skip < 0) {
            throw new NotificationValidationException("take must be positive and skip must not be negative.");
        }
        return Math.min(take, MAX_PAGE);
    }

    /** Soft delete: the row stays for audit but is never listed or dispatched again. */
    public void disable(String id) {
        if (notifications.deactivate(id, clock.instant()) == 0) {
            throw new NotificationNotFoundException(id);
        }
        log.info("Notification {} disabled", id);
    }

    public UserPreference upsertPreferences(PreferenceRequest request) {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getUserId())) {
            errors.add("userId is required.");
        }
        if (request.getMaxDailyNotifications() != null && request.getMaxDailyNotifications() < 0) {
            errors.add("maxDailyNotifications must not be negative.");
        }
        if ((request.getQuietHoursStart() == null) != (request.getQuietHoursEnd() == null)) {
            errors.add("quietHoursStart and quietHoursEnd must be set together.");
        }
        if (!errors.isEmpty()) {
            throw new NotificationValidationException(errors);
        }

        UserPreference pref = UserPreference.builder()
                .userId(request.getUserId())
                .emailEnabled(request.isEmailEnabled())
                .smsEnabled(request.isSmsEnabled())
                .inAppEnabled(request.isInAppEnabled())
                .doNotDisturb(request.isDoNotDisturb())
                .maxDailyNotifications(request.getMaxDailyNotifications())
                .quietHoursStart(request.getQuietHoursStart())
                .quietHoursEnd(request.getQuietHoursEnd())
                .active(true)
                .build();
        preferences.upsert(pref, clock.instant());
        log.info("Preferences updated for user {}", pref.getUserId());
        return pref;
    }

    private void checkDailyCap(String userId, Instant now) {
        Optional<UserPreference> pref = preferences.findByUserId(userId);
        if (pref.isEmpty() || !pref.get().isActive() || pref.get().getMaxDailyNotifications() == null) {
            return;
        }
        ZoneId zone = props.zoneId();
        Instant startOfDay = LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
        int sentToday = notifications.countSentSince(userId, startOfDay);
        if (sentToday >= pref.get().getMaxDailyNotifications()) {
            throw new NotificationValidationException("User has reached the daily notification limit.");
        }
    }

    static String dedupKey(CreateNotificationRequest request) {
        if (!StringUtils.hasText(request.getCorrelationId())) return null;
        return request.getCorrelationId() + ":" + request.getType() + ":" + request.getChannel();
    }

    private static String firstNonBlank(CreateNotificationRequest request,
                                        Function<CreateNotificationRequest.Recipient, String> field) {
        return request.getRecipients().stream()
                .filter(Objects::nonNull)
                .map(field)
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse(null);
    }

    private static void validate(CreateNotificationRequest request) {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getUserId())) {
            errors.add("userId is required.");
        }
        if (request.getChannel() == null) {
            errors.add("channel is required.");
        }
        if (request.getType() == null) {
            errors.add("type is required.");
        }
        if (request.getRecipients() == null || request.getRecipients().isEmpty()) {
            errors.add("At least one recipient is required.");
        } else {
            if (request.getChannel() == NotificationChannel.EMAIL
                    && request.getRecipients().stream().noneMatch(r -> r != null && StringUtils.hasText(r.getEmail()))) {
                errors.add("Email channel requires at least one email recipient.");
            }
            if (request.getChannel() == NotificationChannel.SMS
                    && request.getRecipients().stream().noneMatch(r -> r != null && StringUtils.hasText(r.getPhoneNumber()))) {
                errors.add("SMS channel requires at least one phone number recipient.");
            }
        }
        if (!errors.isEmpty()) {
            throw new NotificationValidationException(errors);
        }
    }
}
