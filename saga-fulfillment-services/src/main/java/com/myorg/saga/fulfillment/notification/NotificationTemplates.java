package com.myorg.saga.fulfillment.notification;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Built-in subject and body per type. Placeholders are {@code {{name}}}; unknown ones render empty. */
final class NotificationTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

    private static final Map<NotificationType, String[]> TEMPLATES = new EnumMap<>(NotificationType.class);

    static {
        TEMPLATES.put(NotificationType.ORDER_CONFIRMED, new String[]{
                "Order {{orderNumber}} confirmed",
                "Hi {{customerName}}, your order {{orderNumber}} for {{totalAmount}} has been confirmed."
        });
        TEMPLATES.put(NotificationType.ORDER_CANCELLED, new String[]{
                "Order {{orderNumber}} cancelled",
                "Hi {{customerName}}, your order {{orderNumber}} has been cancelled: {{reason}}."
        });
        TEMPLATES.put(NotificationType.GENERAL, new String[]{
                "{{subject}}",
                "{{message}}"
        });
    }

    private NotificationTemplates() {
    }

    static String subject(NotificationType type, Map<String, String> data) {
        return render(TEMPLATES.get(type)[0], data);
    }

    static String content(NotificationType type, Map<String, String> data) {
        return render(TEMPLATES.get(type)[1], data);
    }

    static String render(String template, Map<String, String> data) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = data == null ? null : data.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(out);
        return out.toString().trim();
    }
}
