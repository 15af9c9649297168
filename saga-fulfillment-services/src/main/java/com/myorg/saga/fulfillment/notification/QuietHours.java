package com.myorg.saga.fulfillment.notification;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Daily do-not-disturb window in local time. start &gt; end wraps midnight (22:00-07:00),
 * start == end is an empty window. The end is exclusive.
 */
public record QuietHours(LocalTime start, LocalTime end) {

    public static final QuietHours NONE = new QuietHours(LocalTime.MIDNIGHT, LocalTime.MIDNIGHT);

    public static QuietHours of(LocalTime start, LocalTime end) {
        if (start == null || end == null) return NONE;
        return new QuietHours(start, end);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public boolean contains(LocalTime time) {
        if (isEmpty()) return false;
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public boolean contains(Instant instant, ZoneId zone) {
        return contains(instant.atZone(zone).toLocalTime());
    }

    /** Next occurrence of the window end strictly after {@code now}. */
    public Instant nextEnd(Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime candidate = ZonedDateTime.of(local.toLocalDate(), end, zone);
        if (!candidate.isAfter(local)) {
            candidate = ZonedDateTime.of(local.toLocalDate().plusDays(1), end, zone);
        }
        return candidate.toInstant();
    }
}
