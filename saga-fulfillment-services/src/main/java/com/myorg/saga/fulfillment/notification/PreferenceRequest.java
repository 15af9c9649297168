package com.myorg.saga.fulfillment.notification;

import lombok.Data;

import java.time.LocalTime;

@Data
public class PreferenceRequest {
    private String userId;
    private boolean emailEnabled = true;
    private boolean smsEnabled = true;
    private boolean inAppEnabled = true;
    private boolean doNotDisturb;
    private Integer maxDailyNotifications;
    private LocalTime quietHoursStart;
    private LocalTime quietHoursEnd;
}
