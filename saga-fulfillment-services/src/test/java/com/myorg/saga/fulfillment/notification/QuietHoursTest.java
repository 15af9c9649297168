package com.myorg.saga.fulfillment.notification;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class QuietHoursTest {

    @Test
    void sameDayWindow_endIsExclusive() {
        QuietHours q = QuietHours.of(LocalTime.of(13, 0), LocalTime.of(14, 0));

        assertThat(q.contains(LocalTime.of(12, 59))).isFalse();
        assertThat(q.contains(LocalTime.of(13, 0))).isTrue();
        assertThat(q.contains(LocalTime.of(13, 59))).isTrue();
        assertThat(q.contains(LocalTime.of(14, 0))).isFalse();
    }

    @Test
    void windowWrapsMidnightWhenStartIsAfterEnd() {
        QuietHours q = QuietHours.of(LocalTime.of(22, 0), LocalTime.of(7, 0));

        assertThat(q.contains(LocalTime.of(23, 30))).isTrue();
        assertThat(q.contains(LocalTime.of(2, 0))).isTrue();
        assertThat(q.contains(LocalTime.of(7, 0))).isFalse();
        assertThat(q.contains(LocalTime.of(12, 0))).isFalse();
    }

    @Test
    void equalBoundsOrMissingBoundMeanNoWindow() {
        assertThat(QuietHours.of(LocalTime.NOON, LocalTime.NOON).contains(LocalTime.NOON)).isFalse();
        assertThat(QuietHours.of(null, LocalTime.NOON).isEmpty()).isTrue();
    }

    @Test
    void nextEnd_isTodayOrTomorrow() {
        QuietHours q = QuietHours.of(LocalTime.of(22, 0), LocalTime.of(7, 0));

        assertThat(q.nextEnd(Instant.parse("2026-03-01T23:00:00Z"), ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2026-03-02T07:00:00Z"));
        assertThat(q.nextEnd(Instant.parse("2026-03-02T03:00:00Z"), ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2026-03-02T07:00:00Z"));
    }

    @Test
    void evaluatedInTheConfiguredZone() {
        QuietHours q = QuietHours.of(LocalTime.of(22, 0), LocalTime.of(7, 0));
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        // 14:00 UTC is 23:00 in Tokyo
        Instant now = Instant.parse("2026-03-01T14:00:00Z");

        assertThat(q.contains(now, ZoneOffset.UTC)).isFalse();
        assertThat(q.contains(now, tokyo)).isTrue();
        assertThat(q.nextEnd(now, tokyo)).isEqualTo(Instant.parse("2026-03-01T22:00:00Z"));
    }
}
