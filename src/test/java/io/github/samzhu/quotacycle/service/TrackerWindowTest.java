package io.github.samzhu.quotacycle.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import io.github.samzhu.quotacycle.dto.analytics.WindowPoint;

class TrackerWindowTest {

    private static final Instant T0 = Instant.parse("2026-01-10T08:00:00Z");

    @Test
    void shouldDropPointsOlderThanSpan() {
        // Given
        TrackerWindow window = new TrackerWindow(Duration.ofMinutes(30));

        // When
        window.add(T0, 1);
        window.add(T0.plus(Duration.ofMinutes(20)), 2);
        window.add(T0.plus(Duration.ofMinutes(40)), 3);

        // Then: T0 超出 30 分鐘範圍
        assertThat(window.snapshot())
            .extracting(WindowPoint::consumed)
            .containsExactly(2.0, 3.0);
    }

    @Test
    void shouldRejectNonIncreasingTimestamps() {
        // Given
        TrackerWindow window = new TrackerWindow(Duration.ofMinutes(30));
        window.add(T0.plusSeconds(60), 5);

        // Then
        assertThat(window.add(T0, 4)).isFalse();
        assertThat(window.add(T0.plusSeconds(60), 4)).isFalse();
        assertThat(window.size()).isEqualTo(1);
    }

    @Test
    void shouldClear() {
        TrackerWindow window = new TrackerWindow(Duration.ofMinutes(30));
        window.add(T0, 1);

        window.clear();

        assertThat(window.snapshot()).isEmpty();
    }
}
