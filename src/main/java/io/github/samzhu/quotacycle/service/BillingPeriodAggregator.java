package io.github.samzhu.quotacycle.service;

import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriod;
import io.github.samzhu.quotacycle.dto.analytics.BillingPeriodRollup;

/**
 * 計費週期合併工具。
 *
 * <p>供應商回報的重置時間會在真正的邊界附近漂移，使 {@link CycleDetector} 切出數個小週期。
 * 此工具由舊到新走訪週期，以與偵測器相同的跌落規則（峰值跌破一半）判斷真正的計費邊界：
 * <ul>
 *   <li>跌落：結束目前的計費週期，以該週期的開始時間開啟新計費週期</li>
 *   <li>否則：併入目前的計費週期，峰值取最大值</li>
 * </ul>
 *
 * <p>純函數，相同輸入永遠得到相同結果。
 */
public final class BillingPeriodAggregator {

    private BillingPeriodAggregator() {
        // 工具類不允許實例化
    }

    /**
     * 將週期合併為計費週期。
     *
     * @param cyclesNewestFirst 週期清單，由新到舊（儲存層的排序）
     * @return 計費週期，由舊到新
     */
    public static List<BillingPeriod> group(List<QuotaCycle> cyclesNewestFirst) {
        List<BillingPeriod> periods = new ArrayList<>();
        if (cyclesNewestFirst == null || cyclesNewestFirst.isEmpty()) {
            return periods;
        }

        int last = cyclesNewestFirst.size() - 1;
        QuotaCycle oldest = cyclesNewestFirst.get(last);
        BillingPeriod current = new BillingPeriod(oldest.cycleStart(), oldest.peak(), 1);

        for (int i = last - 1; i >= 0; i--) {
            QuotaCycle cycle = cyclesNewestFirst.get(i);
            if (CycleDetector.isDrop(current.maxPeak(), cycle.peak())) {
                periods.add(current);
                current = new BillingPeriod(cycle.cycleStart(), cycle.peak(), 1);
            } else {
                current = new BillingPeriod(current.start(), Math.max(current.maxPeak(), cycle.peak()),
                    current.cycleCount() + 1);
            }
        }
        periods.add(current);
        return periods;
    }

    /**
     * 合併並建立彙總。
     *
     * @param cyclesNewestFirst 週期清單，由新到舊
     * @return 彙總
     */
    public static BillingPeriodRollup rollup(List<QuotaCycle> cyclesNewestFirst) {
        return new BillingPeriodRollup(group(cyclesNewestFirst));
    }
}
