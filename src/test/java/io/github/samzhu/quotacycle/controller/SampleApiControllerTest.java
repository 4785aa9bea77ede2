package io.github.samzhu.quotacycle.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.quotacycle.config.GlobalExceptionAdvice;
import io.github.samzhu.quotacycle.document.QuotaCycle;
import io.github.samzhu.quotacycle.dto.IngestOutcome;
import io.github.samzhu.quotacycle.dto.IngestStats;
import io.github.samzhu.quotacycle.dto.QuotaKey;
import io.github.samzhu.quotacycle.dto.QuotaSampleData;
import io.github.samzhu.quotacycle.exception.CycleStoreException;
import io.github.samzhu.quotacycle.exception.SampleNormalizationException;
import io.github.samzhu.quotacycle.service.QuotaTrackingService;

class SampleApiControllerTest {

    private static final String SAMPLE_JSON = """
        {
          "provider": "synthetic",
          "quotaType": "subscription",
          "capturedAt": "2026-01-10T08:00:00Z",
          "counterKind": "INCREASING_USAGE",
          "rawFields": { "requests": 42 },
          "limit": 1350
        }
        """;

    private QuotaTrackingService trackingService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        trackingService = mock(QuotaTrackingService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SampleApiController(trackingService))
            .setControllerAdvice(new GlobalExceptionAdvice())
            .build();
    }

    @Test
    void shouldIngestSample() throws Exception {
        // Given
        QuotaCycle cycle = QuotaCycle.open(new QuotaKey("synthetic", "subscription"),
            Instant.parse("2026-01-10T08:00:00Z"), 42.0, 1350.0, null).withId("c1");
        when(trackingService.ingest(any(QuotaSampleData.class))).thenReturn(IngestOutcome.created(cycle));

        // When / Then
        mockMvc.perform(post("/api/v1/samples").contentType(MediaType.APPLICATION_JSON).content(SAMPLE_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CREATED"))
            .andExpect(jsonPath("$.cycle.id").value("c1"));
    }

    @Test
    void shouldRejectMissingFields() throws Exception {
        // Given: 缺少 provider 與 capturedAt
        String body = """
            { "quotaType": "subscription", "rawFields": { "requests": 1 } }
            """;

        // When / Then
        mockMvc.perform(post("/api/v1/samples").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_failed"));
        verify(trackingService, never()).ingest(any(QuotaSampleData.class));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/samples").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("malformed_request"));
    }

    @Test
    void shouldReturnUnprocessableForDiscardedSample() throws Exception {
        when(trackingService.ingest(any(QuotaSampleData.class)))
            .thenThrow(new SampleNormalizationException("synthetic/subscription", "missing field 'requests'"));

        mockMvc.perform(post("/api/v1/samples").contentType(MediaType.APPLICATION_JSON).content(SAMPLE_JSON))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("sample_unprocessable"));
    }

    @Test
    void shouldReturnServiceUnavailableOnStoreFailure() throws Exception {
        when(trackingService.ingest(any(QuotaSampleData.class)))
            .thenThrow(new CycleStoreException("createCycle", "synthetic/subscription",
                new DataAccessResourceFailureException("mongo down")));

        mockMvc.perform(post("/api/v1/samples").contentType(MediaType.APPLICATION_JSON).content(SAMPLE_JSON))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    void shouldReturnStats() throws Exception {
        when(trackingService.getStats()).thenReturn(new IngestStats(10, 2, 1, 3, 4, 2));

        mockMvc.perform(get("/api/v1/samples/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ingested").value(10))
            .andExpect(jsonPath("$.outOfOrder").value(3))
            .andExpect(jsonPath("$.trackedKeys").value(2));
    }
}
