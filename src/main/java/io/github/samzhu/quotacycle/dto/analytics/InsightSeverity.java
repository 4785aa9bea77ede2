package io.github.samzhu.quotacycle.dto.analytics;

/**
 * 洞察嚴重程度，對應前端的顏色樣式。
 */
public enum InsightSeverity {
    POSITIVE,
    INFO,
    WARNING,
    NEGATIVE;

    /**
     * 前端使用的小寫名稱。
     */
    public String label() {
        return name().toLowerCase();
    }
}
