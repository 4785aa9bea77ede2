package io.github.samzhu.quotacycle.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class QuotaFormatTest {

    @Test
    void shouldFormatDurations() {
        assertThat(QuotaFormat.duration(Duration.ofMinutes(45))).isEqualTo("45m");
        assertThat(QuotaFormat.duration(Duration.ofMinutes(170))).isEqualTo("2h 50m");
        assertThat(QuotaFormat.duration(Duration.ofHours(3))).isEqualTo("3h");
        assertThat(QuotaFormat.duration(Duration.ofHours(53))).isEqualTo("2d 5h");
        assertThat(QuotaFormat.duration(Duration.ofDays(2).plusMinutes(7))).isEqualTo("2d 7m");
        assertThat(QuotaFormat.duration(Duration.ofMinutes(-1))).isEqualTo("Resetting...");
    }

    @Test
    void shouldFormatHours() {
        // 850 / 300 小時
        assertThat(QuotaFormat.hours(850.0 / 300.0)).isEqualTo("2h 50m");
    }

    @Test
    void shouldFormatAmounts() {
        assertThat(QuotaFormat.amount(42)).isEqualTo("42");
        assertThat(QuotaFormat.amount(2.75)).isEqualTo("2.8");
        assertThat(QuotaFormat.amount(850)).isEqualTo("850");
        assertThat(QuotaFormat.amount(12_500)).isEqualTo("12.5K");
        assertThat(QuotaFormat.amount(1_200_000)).isEqualTo("1.2M");
        assertThat(QuotaFormat.percent(42.4)).isEqualTo("42%");
    }
}
