package io.github.samzhu.quotacycle.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriod;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;

class BillingPeriodAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldMergeJitterSplitCyclesIntoTwoPeriods() {
        // Given: 由舊到新的峰值 [20, 22, 21, 3, 18, 19]
        List<QuotaCycle> newestFirst = cyclesNewestFirst(20, 22, 21, 3, 18, 19);

        // When
        List<BillingPeriod> periods = BillingPeriodAggregator.group(newestFirst);

        // Then
        assertThat(periods).hasSize(2);
        assertThat(periods.get(0).maxPeak()).isEqualTo(22.0);
        assertThat(periods.get(0).start()).isEqualTo(T0);
        assertThat(periods.get(0).cycleCount()).isEqualTo(3);
        assertThat(periods.get(1).maxPeak()).isEqualTo(19.0);
        assertThat(periods.get(1).start()).isEqualTo(T0.plus(Duration.ofHours(3)));
        assertThat(periods.get(1).cycleCount()).isEqualTo(3);
    }

    @Test
    void shouldBeIdempotent() {
        // Given
        List<QuotaCycle> newestFirst = cyclesNewestFirst(50, 10, 48, 52, 4, 40, 45, 2);

        // When
        List<BillingPeriod> first = BillingPeriodAggregator.group(newestFirst);
        List<BillingPeriod> second = BillingPeriodAggregator.group(newestFirst);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldReturnEmptyForNoCycles() {
        assertThat(BillingPeriodAggregator.group(List.of())).isEmpty();
        assertThat(BillingPeriodAggregator.rollup(List.of()).average()).isZero();
    }

    @Test
    void shouldAlwaysEmitFinalPeriod() {
        // Given: 單一週期
        List<BillingPeriod> periods = BillingPeriodAggregator.group(cyclesNewestFirst(7));

        // Then
        assertThat(periods).singleElement()
            .extracting(BillingPeriod::maxPeak)
            .isEqualTo(7.0);
    }

    @Test
    void shouldComputeRollupAccessors() {
        // Given: 三個計費週期，峰值 100 / 80 / 90
        List<QuotaCycle> newestFirst = cyclesNewestFirst(100, 30, 80, 10, 90);

        // When
        BillingPeriodRollup rollup = BillingPeriodAggregator.rollup(newestFirst);

        // Then
        assertThat(rollup.count()).isEqualTo(3);
        assertThat(rollup.sum()).isEqualTo(270.0);
        assertThat(rollup.average()).isEqualTo(90.0);
        assertThat(rollup.max()).isEqualTo(100.0);
        // 計費週期分別從第 0、1、3 小時開始
        assertThat(rollup.sumSince(T0.plus(Duration.ofHours(1)))).isEqualTo(170.0);
        assertThat(rollup.sumSince(T0.plus(Duration.ofHours(2)))).isEqualTo(90.0);
        assertThat(rollup.sumSince(T0.plus(Duration.ofHours(5)))).isZero();
    }

    /**
     * 依由舊到新的峰值建立週期，每小時一個，回傳由新到舊的清單。
     */
    static List<QuotaCycle> cyclesNewestFirst(double... peaksOldestFirst) {
        List<QuotaCycle> cycles = new ArrayList<>();
        for (int i = 0; i < peaksOldestFirst.length; i++) {
            Instant start = T0.plus(Duration.ofHours(i));
            Instant end = start.plus(Duration.ofMinutes(59));
            double peak = peaksOldestFirst[i];
            cycles.add(new QuotaCycle("c" + i, "synthetic/subscription", start, end, false,
                0.0, peak, peak, end, peak, null, null, start, end));
        }
        Collections.reverse(cycles);
        return cycles;
    }
}
