package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.contracts.core.envelope.EventEnvelope;
import com.myorg.saga.contracts.fulfillment.FulfillmentEventTypes;
import com.myorg.saga.contracts.fulfillment.events.OrderCancelledEvent;
import com.myorg.saga.contracts.fulfillment.events.OrderConfirmedEvent;
import com.myorg.saga.eventing.SagaEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns terminal saga events into notification requests: EMAIL always, SMS as well when the order
 * has a phone number and {@code saga.notification.sms-on-terminal-events} is on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationSagaHandlers {

    static final String ACTOR = "saga";

    private final NotificationService notifications;
    private final NotificationProperties props;

    @SagaEventHandler(value = FulfillmentEventTypes.ORDER_CONFIRMED, payload = OrderConfirmedEvent.class)
    public void onOrderConfirmed(EventEnvelope env, OrderConfirmedEvent confirmed) {
        Map<String, String> data = templateData(confirmed.getOrderNumber(), confirmed.getCustomerName(),
                confirmed.getTotalAmount());
        notify(env, NotificationType.ORDER_CONFIRMED, confirmed.getUserId(), confirmed.getCustomerEmail(),
                confirmed.getPhoneNumber(), data);
    }

    @SagaEventHandler(value = FulfillmentEventTypes.ORDER_CANCELLED, payload = OrderCancelledEvent.class)
    public void onOrderCancelled(EventEnvelope env, OrderCancelledEvent cancelled) {
        Map<String, String> data = templateData(cancelled.getOrderNumber(), cancelled.getCustomerName(),
                cancelled.getTotalAmount());
        data.put("reason", StringUtils.hasText(cancelled.getReason()) ? cancelled.getReason() : OrderCancelledEvent.DEFAULT_REASON);
        notify(env, NotificationType.ORDER_CANCELLED, cancelled.getUserId(), cancelled.getCustomerEmail(),
                cancelled.getPhoneNumber(), data);
    }

    private void notify(EventEnvelope env, NotificationType type, String userId, String email, String phone,
                        Map<String, String> data) {
        create(env, type, NotificationChannel.EMAIL, userId, email, null, data);
        if (props.isSmsOnTerminalEvents() && StringUtils.hasText(phone)) {
            create(env, type, NotificationChannel.SMS, userId, null, phone, data);
        }
    }

    private void create(EventEnvelope env, NotificationType type, NotificationChannel channel, String userId,
                        String email, String phone, Map<String, String> data) {
        CreateNotificationRequest request = CreateNotificationRequest.builder()
                .userId(userId)
                .channel(channel)
                .type(type)
                .templateData(data)
                .recipients(List.of(new CreateNotificationRequest.Recipient(email, phone)))
                .correlationId(env.getCorrelationId())
                .createdBy(ACTOR)
                .build();
        try {
            notifications.create(request);
        } catch (NotificationValidationException e) {
            // redelivery cannot fix a missing recipient or a reached cap
            log.warn("No {} {} notification for order {}: {}", channel, type, env.getCorrelationId(), e.getErrors());
        }
    }

    private static Map<String, String> templateData(String orderNumber, String customerName, BigDecimal total) {
        Map<String, String> data = new HashMap<>();
        data.put("orderNumber", orderNumber);
        data.put("customerName", StringUtils.hasText(customerName) ? customerName : "customer");
        data.put("totalAmount", total == null ? "" : total.toPlainString());
        return data;
    }
}
