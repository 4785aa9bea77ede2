package io.github.samzhu.quotacycle.dto.api;

import java.util.List;

import io.github.samzhu.quotacycle.dto.analytics.InsightItem;

/**
 * 配額洞察 API 回應。
 *
 * @param quotaKey 配額鍵
 * @param displayName 顯示名稱
 * @param stats 統計卡片
 * @param insights 洞察卡片
 */
public record InsightsResponse(
    String quotaKey,
    String displayName,
    List<InsightItem> stats,
    List<InsightItem> insights
) {
}
