package com.myorg.saga.fulfillment.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/** One row per user. Absent means every channel enabled, no quiet hours and no cap. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPreference {
    private String userId;
    @Builder.Default
    private boolean emailEnabled = true;
    @Builder.Default
    private boolean smsEnabled = true;
    @Builder.Default
    private boolean inAppEnabled = true;
    private boolean doNotDisturb;
    /** null = unlimited */
    private Integer maxDailyNotifications;
    private LocalTime quietHoursStart;
    private LocalTime quietHoursEnd;
    @Builder.Default
    private boolean active = true;

    public boolean isChannelEnabled(NotificationChannel channel) {
        return switch (channel) {
            case EMAIL -> emailEnabled;
            case SMS -> smsEnabled;
            case IN_APP -> inAppEnabled;
        };
    }

    public QuietHours quietHours() {
        return QuietHours.of(quietHoursStart, quietHoursEnd);
    }
}
