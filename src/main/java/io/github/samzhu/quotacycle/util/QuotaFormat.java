package io.github.samzhu.quotacycle.util;

import java.time.Duration;
import java.util.Locale;

/**
 * 洞察卡片使用的數值與時間格式化工具。
 */
public final class QuotaFormat {

    private QuotaFormat() {
        // 工具類不允許實例化
    }

    /**
     * 格式化時間長度。
     *
     * @param duration 時間長度
     * @return 格式如 "2d 5h"、"2h 50m"、"45m"；負值返回 "Resetting..."
     */
    public static String duration(Duration duration) {
        if (duration.isNegative()) {
            return "Resetting...";
        }
        long totalHours = duration.toHours();
        long days = totalHours / 24;
        long hours = totalHours % 24;
        long minutes = duration.toMinutes() % 60;

        if (days > 0 && hours > 0) {
            return String.format(Locale.ROOT, "%dd %dh", days, hours);
        } else if (days > 0) {
            return String.format(Locale.ROOT, "%dd %dm", days, minutes);
        } else if (hours > 0 && minutes > 0) {
            return String.format(Locale.ROOT, "%dh %dm", hours, minutes);
        } else if (hours > 0) {
            return String.format(Locale.ROOT, "%dh", hours);
        }
        return String.format(Locale.ROOT, "%dm", minutes);
    }

    /**
     * 以小時數格式化時間長度。
     */
    public static String hours(double hours) {
        return duration(Duration.ofSeconds(Math.round(hours * 3600)));
    }

    /**
     * 格式化數量，大數值使用 K / M 縮寫。
     *
     * @param value 數量
     * @return 格式如 "850"、"12.5K"、"1.2M"
     */
    public static String amount(double value) {
        double abs = Math.abs(value);
        if (abs >= 1_000_000) {
            return String.format(Locale.ROOT, "%.1fM", value / 1_000_000);
        }
        if (abs >= 10_000) {
            return String.format(Locale.ROOT, "%.1fK", value / 1_000);
        }
        if (abs >= 100 || value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * 格式化百分比，例如 "42%"。
     */
    public static String percent(double value) {
        return String.format(Locale.ROOT, "%.0f%%", value);
    }
}
