package io.github.samzhu.quotacycle.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.IngestStats;
import io.github.samzhu.quotacycle.dto.QuotaSampleData;
import io.github.samzhu.quotacycle.dto.api.IngestResponse;
import io.github.samzhu.quotacycle.service.QuotaTrackingService;

import jakarta.validation.Valid;

/**
 * 樣本寫入 API 控制器。
 *
 * <p>提供同步寫入單筆樣本（不經訊息通道的輪詢端使用）與處理計數查詢。
 */
@RestController
@RequestMapping("/api/v1/samples")
public class SampleApiController {

    private static final Logger log = LoggerFactory.getLogger(SampleApiController.class);

    private final QuotaTrackingService trackingService;

    public SampleApiController(QuotaTrackingService trackingService) {
        this.trackingService = trackingService;
    }

    /**
     * 寫入一筆配額樣本。
     *
     * @param sample 樣本
     * @return 處理結果；亂序樣本同樣回應 200，狀態為 OUT_OF_ORDER
     */
    @PostMapping
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody QuotaSampleData sample) {
        log.debug("Ingesting sample: provider={}, quotaType={}, capturedAt={}",
            sample.provider(), sample.quotaType(), sample.capturedAt());
        IngestOutcome outcome = trackingService.ingest(sample);
        return ResponseEntity.ok(IngestResponse.fromOutcome(outcome));
    }

    /**
     * 取得處理計數。
     */
    @GetMapping("/stats")
    public ResponseEntity<IngestStats> getStats() {
        return ResponseEntity.ok(trackingService.getStats());
    }
}
