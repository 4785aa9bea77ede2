package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 消耗速率估計。
 *
 * @param perHour 每小時消耗量；資料不足時為 null
 * @param source 速率來源
 */
public record RateEstimate(
    Double perHour,
    RateSource source
) {

    public static RateEstimate undefined() {
        return new RateEstimate(null, RateSource.NONE);
    }

    public boolean isDefined() {
        return perHour != null;
    }
}
