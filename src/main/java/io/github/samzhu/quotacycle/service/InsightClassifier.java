package io.github.samzhu.quotacycle.service;

import io.github.samzhu.quotacycle.dto.analytics.InsightSeverity;
import io.github.samzhu.quotacycle.dto.analytics.TrendDirection;
import io.github.samzhu.quotacycle.dto.analytics.TrendResult;
import io.github.samzhu.quotacycle.dto.analytics.UsageLevel;
import io.github.samzhu.quotacycle.dto.analytics.VarianceLevel;
import io.github.samzhu.quotacycle.dto.analytics.VarianceResult;

/**
 * 洞察分類器，將百分比與變化量對應到固定的等級。
 *
 * <p>門檻值為常數，不提供執行期設定：
 * <ul>
 *   <li>使用率：95 / 80 / 50</li>
 *   <li>趨勢：±15%</li>
 *   <li>離散度：50% / 10%</li>
 * </ul>
 */
public final class InsightClassifier {

    public static final double CRITICAL_PERCENT = 95.0;
    public static final double DANGER_PERCENT = 80.0;
    public static final double WARNING_PERCENT = 50.0;

    public static final double TREND_THRESHOLD = 15.0;

    public static final double HIGH_VARIANCE = 50.0;
    public static final double MODERATE_VARIANCE = 10.0;

    private InsightClassifier() {
        // 工具類不允許實例化
    }

    /**
     * 依使用率判斷等級。
     *
     * @param percent 使用率 (0-100+)
     * @return 使用率等級
     */
    public static UsageLevel classifyUsage(double percent) {
        if (percent >= CRITICAL_PERCENT) {
            return UsageLevel.CRITICAL;
        }
        if (percent >= DANGER_PERCENT) {
            return UsageLevel.DANGER;
        }
        if (percent >= WARNING_PERCENT) {
            return UsageLevel.WARNING;
        }
        return UsageLevel.HEALTHY;
    }

    public static InsightSeverity severityOf(double percent) {
        return classifyUsage(percent).severity();
    }

    /**
     * 比較近期與較早的平均值。
     *
     * @param olderAvg 較早一半計費週期的平均峰值，須大於 0
     * @param recentAvg 近期一半計費週期的平均峰值
     * @return 趨勢結果
     */
    public static TrendResult classifyTrend(double olderAvg, double recentAvg) {
        if (olderAvg <= 0) {
            throw new IllegalArgumentException("olderAvg must be positive: " + olderAvg);
        }
        double change = (recentAvg - olderAvg) / olderAvg * 100.0;
        TrendDirection direction;
        if (change > TREND_THRESHOLD) {
            direction = TrendDirection.RISING;
        } else if (change < -TREND_THRESHOLD) {
            direction = TrendDirection.FALLING;
        } else {
            direction = TrendDirection.STABLE;
        }
        return new TrendResult(direction, change);
    }

    /**
     * 以峰值高出平均的比例判斷離散度。
     *
     * @param avg 平均峰值，須大於 0
     * @param peak 最大峰值
     * @return 離散度結果
     */
    public static VarianceResult classifyVariance(double avg, double peak) {
        if (avg <= 0) {
            throw new IllegalArgumentException("avg must be positive: " + avg);
        }
        double diff = (peak - avg) / avg * 100.0;
        VarianceLevel level;
        if (diff > HIGH_VARIANCE) {
            level = VarianceLevel.HIGH;
        } else if (diff > MODERATE_VARIANCE) {
            level = VarianceLevel.MODERATE;
        } else {
            level = VarianceLevel.CONSISTENT;
        }
        return new VarianceResult(level, diff);
    }
}
