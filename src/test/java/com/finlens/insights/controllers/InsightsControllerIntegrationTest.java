package com.finlens.insights.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import com.finlens.insights.dto.insights.FinancialHealthScore;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightsResult;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.dto.insights.TimeFilter;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.TimeFilterPreset;
import com.finlens.insights.services.insights.InsightsService;

@SpringBootTest
@AutoConfigureMockMvc
class InsightsControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InsightsService insightsService;

    private static final Insight NET = Insight.builder()
            .id("net_cashflow")
            .type(InsightType.NET_CASH_FLOW)
            .title("Net cash flow")
            .severity(InsightSeverity.POSITIVE)
            .build();

    @Test
    void getInsights_usesMonthAndUsdByDefault() throws Exception {
        when(insightsService.generateAllInsights(InsightGranularity.MONTH, "USD"))
                .thenReturn(new InsightsResult(List.of(NET), List.of(), PeriodSummary.EMPTY));

        mockMvc.perform(get("/api/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.insights[0].id").value("net_cashflow"))
                .andExpect(jsonPath("$.data.insights[0].severity").value("POSITIVE"));
    }

    @Test
    void getInsights_passesGranularityAndCurrency() throws Exception {
        when(insightsService.generateAllInsights(InsightGranularity.WEEK, "EUR"))
                .thenReturn(new InsightsResult(List.of(), List.of(), PeriodSummary.EMPTY));

        mockMvc.perform(get("/api/insights").param("granularity", "WEEK").param("currency", "EUR"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.insights").isEmpty());
    }

    @Test
    void getInsights_unknownGranularity_returns400() throws Exception {
        mockMvc.perform(get("/api/insights").param("granularity", "DAY"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Invalid value for parameter 'granularity'"))
                .andExpect(jsonPath("$.errors[0]").value("DAY"))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.timestamp").exists());

        verifyNoInteractions(insightsService);
    }

    @Test
    void getInsights_malformedCurrency_returns400() throws Exception {
        mockMvc.perform(get("/api/insights").param("currency", "DOLLARS"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation error"))
                .andExpect(jsonPath("$.errors[0]").value("currency must be a 3-letter ISO code"));

        verifyNoInteractions(insightsService);
    }

    @Test
    void filter_defaultsToThisMonth() throws Exception {
        when(insightsService.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "USD"))
                .thenReturn(List.of(NET));

        mockMvc.perform(get("/api/insights/filter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("net_cashflow"));
    }

    @Test
    void filter_customRange() throws Exception {
        TimeFilter custom = TimeFilter.custom(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 2, 1));
        when(insightsService.generateAllInsights(custom, "USD")).thenReturn(List.of());

        mockMvc.perform(get("/api/insights/filter")
                        .param("preset", "CUSTOM")
                        .param("start", "2026-01-01")
                        .param("end", "2026-02-01"))
                .andExpect(status().isOk());

        verify(insightsService).generateAllInsights(custom, "USD");
    }

    @Test
    void filter_customWithoutEnd_returns400() throws Exception {
        mockMvc.perform(get("/api/insights/filter").param("preset", "CUSTOM").param("start", "2026-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("start and end are required for a CUSTOM range"));

        verifyNoInteractions(insightsService);
    }

    @Test
    void filter_customInvertedRange_returns400() throws Exception {
        mockMvc.perform(get("/api/insights/filter")
                        .param("preset", "CUSTOM")
                        .param("start", "2026-02-01")
                        .param("end", "2026-02-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("start must be before end"));
    }

    @Test
    void healthScore_returnsScore() throws Exception {
        when(insightsService.computeHealthScore(InsightGranularity.MONTH, "USD"))
                .thenReturn(FinancialHealthScore.builder().score(72).grade("Good").build());

        mockMvc.perform(get("/api/insights/health-score"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.score").value(72))
                .andExpect(jsonPath("$.data.grade").value("Good"));
    }

    @Test
    void invalidateCache_clearsAllEntries() throws Exception {
        mockMvc.perform(post("/api/insights/cache/invalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(insightsService).invalidateCache();
    }

    @Test
    void unexpectedError_returns500() throws Exception {
        when(insightsService.generateAllInsights(any(InsightGranularity.class), anyString()))
                .thenThrow(new IllegalStateException("generator failed"));

        mockMvc.perform(get("/api/insights"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
