package com.myorg.saga.fulfillment.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    private String id;
    private String userId;
    private NotificationChannel channel;
    private NotificationType type;
    private NotificationPriority priority;
    private String subject;
    private String content;
    private String recipientEmail;
    private String recipientPhone;
    private String correlationId;
    private String dedupKey;
    private NotificationStatus status;
    private int retryCount;
    private Instant scheduledAt;
    private String lastError;
    private boolean active;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
