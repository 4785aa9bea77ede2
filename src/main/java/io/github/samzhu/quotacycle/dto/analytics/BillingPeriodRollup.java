package io.github.samzhu.quotacycle.dto.analytics;

import java.time.Instant;
import java.util.List;

/**
 * 計費週期彙總，依時間由舊到新排列。
 *
 * @param periods 計費週期
 */
public record BillingPeriodRollup(
    List<BillingPeriod> periods
) {

    public BillingPeriodRollup {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    public int count() {
        return periods.size();
    }

    public double sum() {
        return periods.stream().mapToDouble(BillingPeriod::maxPeak).sum();
    }

    /**
     * 平均峰值，沒有計費週期時為 0。
     */
    public double average() {
        return periods.isEmpty() ? 0.0 : sum() / periods.size();
    }

    public double max() {
        return periods.stream().mapToDouble(BillingPeriod::maxPeak).max().orElse(0.0);
    }

    /**
     * 計算在指定時間之後開始的計費週期峰值總和。
     *
     * @param since 起始時間（含）
     * @return 峰值總和
     */
    public double sumSince(Instant since) {
        return periods.stream()
            .filter(p -> !p.start().isBefore(since))
            .mapToDouble(BillingPeriod::maxPeak)
            .sum();
    }
}
