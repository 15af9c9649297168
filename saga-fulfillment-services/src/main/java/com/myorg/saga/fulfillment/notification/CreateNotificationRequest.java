package com.myorg.saga.fulfillment.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationRequest {
    private String userId;
    @Builder.Default
    private NotificationChannel channel = NotificationChannel.EMAIL;
    @Builder.Default
    private NotificationType type = NotificationType.GENERAL;
    @Builder.Default
    private NotificationPriority priority = NotificationPriority.NORMAL;
    private String subject;
    /** Rendered from the type's template and {@link #templateData} when blank. */
    private String content;
    private Map<String, String> templateData;
    @Builder.Default
    private List<Recipient> recipients = new ArrayList<>();
    private Instant scheduledAt;
    /** Set by saga handlers; makes creation idempotent per (correlation id, type, channel). */
    private String correlationId;
    @Builder.Default
    private String createdBy = "system";

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recipient {
        private String email;
        private String phoneNumber;
    }
}
