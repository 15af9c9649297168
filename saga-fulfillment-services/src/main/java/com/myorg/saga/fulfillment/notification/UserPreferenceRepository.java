package com.myorg.saga.fulfillment.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UserPreferenceRepository {

    private final JdbcTemplate jdbc;

    public Optional<UserPreference> findByUserId(String userId) {
        return jdbc.query("""
                SELECT user_id, email_enabled, sms_enabled, in_app_enabled, do_not_disturb,
                       max_daily_notifications, quiet_hours_start, quiet_hours_end, is_active
                FROM user_preference
                WHERE user_id=?
                """, (rs, i) -> UserPreference.builder()
                .userId(rs.getString("user_id"))
                .emailEnabled(rs.getBoolean("email_enabled"))
                .smsEnabled(rs.getBoolean("sms_enabled"))
                .inAppEnabled(rs.getBoolean("in_app_enabled"))
                .doNotDisturb(rs.getBoolean("do_not_disturb"))
                .maxDailyNotifications(rs.getObject("max_daily_notifications", Integer.class))
                .quietHoursStart(toLocalTime(rs.getTime("quiet_hours_start")))
                .quietHoursEnd(toLocalTime(rs.getTime("quiet_hours_end")))
                .active(rs.getBoolean("is_active"))
                .build(), userId).stream().findFirst();
    }

    public void upsert(UserPreference p, Instant now) {
        Object[] values = {
                p.isEmailEnabled(), p.isSmsEnabled(), p.isInAppEnabled(), p.isDoNotDisturb(),
                p.getMaxDailyNotifications(), toTime(p.getQuietHoursStart()), toTime(p.getQuietHoursEnd()),
                p.isActive(), Timestamp.from(now), p.getUserId()
        };
        int updated = jdbc.update("""
                UPDATE user_preference
                SET email_enabled=?, sms_enabled=?, in_app_enabled=?, do_not_disturb=?,
                    max_daily_notifications=?, quiet_hours_start=?, quiet_hours_end=?, is_active=?, updated_at=?
                WHERE user_id=?
                """, values);
        if (updated == 0) {
            jdbc.update("""
                    INSERT INTO user_preference
                        (email_enabled, sms_enabled, in_app_enabled, do_not_disturb, max_daily_notifications,
                         quiet_hours_start, quiet_hours_end, is_active, updated_at, user_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, p.isEmailEnabled(), p.isSmsEnabled(), p.isInAppEnabled(), p.isDoNotDisturb(),
                    p.getMaxDailyNotifications(), toTime(p.getQuietHoursStart()), toTime(p.getQuietHoursEnd()),
                    p.isActive(), Timestamp.from(now), p.getUserId(), Timestamp.from(now));
        }
    }

    private static Time toTime(LocalTime t) {
        return t == null ? null : Time.valueOf(t);
    }

    private static LocalTime toLocalTime(Time t) {
        return t == null ? null : t.toLocalTime();
    }
}
