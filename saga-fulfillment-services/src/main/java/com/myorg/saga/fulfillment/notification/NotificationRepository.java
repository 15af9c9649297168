package com.myorg.saga.fulfillment.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

    private static final String COLUMNS = """
            id, user_id, channel, notification_type, priority, subject, content, recipient_email, recipient_phone,
            correlation_id, dedup_key, status, retry_count, scheduled_at, last_error, is_active, created_by,
            created_at, updated_at
            """;

    private static final RowMapper<Notification> ROW = (rs, i) -> Notification.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .channel(NotificationChannel.valueOf(rs.getString("channel")))
            .type(NotificationType.valueOf(rs.getString("notification_type")))
            .priority(NotificationPriority.valueOf(rs.getString("priority")))
            .subject(rs.getString("subject"))
            .content(rs.getString("content"))
            .recipientEmail(rs.getString("recipient_email"))
            .recipientPhone(rs.getString("recipient_phone"))
            .correlationId(rs.getString("correlation_id"))
            .dedupKey(rs.getString("dedup_key"))
            .status(NotificationStatus.valueOf(rs.getString("status")))
            .retryCount(rs.getInt("retry_count"))
            .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
            .lastError(rs.getString("last_error"))
            .active(rs.getBoolean("is_active"))
            .createdBy(rs.getString("created_by"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();

    private final JdbcTemplate jdbc;

    public void insert(Notification n) {
        jdbc.update("""
                INSERT INTO notification (%s)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(COLUMNS),
                n.getId(),
                n.getUserId(),
                n.getChannel().name(),
                n.getType().name(),
                n.getPriority().name(),
                n.getSubject(),
                n.getContent(),
                n.getRecipientEmail(),
                n.getRecipientPhone(),
                n.getCorrelationId(),
                n.getDedupKey(),
                n.getStatus().name(),
                n.getRetryCount(),
                toTimestamp(n.getScheduledAt()),
                n.getLastError(),
                n.isActive(),
                n.getCreatedBy(),
                toTimestamp(n.getCreatedAt()),
                toTimestamp(n.getUpdatedAt()));
    }

    public Optional<Notification> findById(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM notification WHERE id=?", ROW, id).stream().findFirst();
    }

    public Optional<Notification> findByDedupKey(String dedupKey) {
        return jdbc.query("SELECT " + COLUMNS + " FROM notification WHERE dedup_key=?", ROW, dedupKey)
                .stream().findFirst();
    }

    /** Active notifications of a user, newest first. */
    public List<Notification> findByUser(String userId, int take, int skip) {
        return jdbc.query("""
                SELECT %s FROM notification
                WHERE user_id=? AND is_active=TRUE
                ORDER BY created_at DESC, id DESC
                LIMIT ? OFFSET ?
                """.formatted(COLUMNS), ROW, userId, take, skip);
    }

    /**
     * Due: PENDING, or FAILED after at least one real attempt with retries left; active; not scheduled
     * in the future. Oldest first.
     */
    public List<Notification> findDue(Instant now, int maxRetries, int take, int skip) {
        return jdbc.query("""
                SELECT %s FROM notification
                WHERE is_active=TRUE
                  AND (status='PENDING' OR (status='FAILED' AND retry_count > 0 AND retry_count < ?))
                  AND (scheduled_at IS NULL OR scheduled_at <= ?)
                ORDER BY created_at, id
                LIMIT ? OFFSET ?
                """.formatted(COLUMNS), ROW, maxRetries, Timestamp.from(now), take, skip);
    }

    /** Notifications delivered to the user at or after {@code since}, by send time. */
    public int countSentSince(String userId, Instant since) {
        Integer n = jdbc.queryForObject("""
                SELECT COUNT(*) FROM notification
                WHERE user_id=? AND status='SENT' AND sent_at >= ?
                """, Integer.class, userId, Timestamp.from(since));
        return n == null ? 0 : n;
    }

    public void markSent(String id, Instant now) {
        jdbc.update("""
                UPDATE notification
                SET status='SENT', last_error=NULL, sent_at=?, updated_at=?
                WHERE id=?
                """, Timestamp.from(now), Timestamp.from(now), id);
    }

    /** Failed attempt: counts toward the retry cap. */
    public void markAttemptFailed(String id, String error, Instant now) {
        jdbc.update("""
                UPDATE notification
                SET status='FAILED', retry_count=retry_count+1, last_error=?, updated_at=?
                WHERE id=?
                """, truncate(error), Timestamp.from(now), id);
    }

    /** Failed without an attempt (channel disabled, cap reached, processing fault). */
    public void markFailed(String id, String error, Instant now) {
        jdbc.update("""
                UPDATE notification
                SET status='FAILED', last_error=?, updated_at=?
                WHERE id=?
                """, truncate(error), Timestamp.from(now), id);
    }

    public void defer(String id, Instant until, String reason, Instant now) {
        jdbc.update("""
                UPDATE notification
                SET status='PENDING', scheduled_at=?, last_error=?, updated_at=?
                WHERE id=?
                """, Timestamp.from(until), reason, Timestamp.from(now), id);
    }

    public int deactivate(String id, Instant now) {
        return jdbc.update("UPDATE notification SET is_active=FALSE, updated_at=? WHERE id=?", Timestamp.from(now), id);
    }

    public void insertAttempt(String notificationId, int attemptNumber, NotificationChannel channel,
                              boolean successful, String providerResponse, String error, Instant now) {
        jdbc.update("""
                INSERT INTO notification_attempt_log
                    (notification_id, attempt_number, attempted_at, channel, successful, provider_response, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """, notificationId, attemptNumber, Timestamp.from(now), channel.name(), successful,
                truncate(providerResponse), truncate(error));
    }

    public int countAttempts(String notificationId) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM notification_attempt_log WHERE notification_id=?",
                Integer.class, notificationId);
        return n == null ? 0 : n;
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= 2000 ? s : s.substring(0, 2000);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
