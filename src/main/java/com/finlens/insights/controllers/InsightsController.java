package com.finlens.insights.controllers;

import java.time.LocalDate;
import java.util.List;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.finlens.insights.config.InsightsProperties;
import com.finlens.insights.dto.ApiResponse;
import com.finlens.insights.dto.insights.FinancialHealthScore;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightsResult;
import com.finlens.insights.dto.insights.TimeFilter;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.TimeFilterPreset;
import com.finlens.insights.exceptions.BadRequestException;
import com.finlens.insights.services.insights.InsightsService;

import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequestMapping("/api/insights")
@RequiredArgsConstructor
public class InsightsController {

    private static final String CURRENCY_PATTERN = "^\\s*[A-Za-z]{3}\\s*$";
    private static final String CURRENCY_MESSAGE = "currency must be a 3-letter ISO code";

    private final InsightsService insightsService;
    private final InsightsProperties properties;

    @GetMapping
    public ResponseEntity<ApiResponse<InsightsResult>> getInsights(
            @RequestParam(defaultValue = "MONTH") InsightGranularity granularity,
            @RequestParam(required = false) @Pattern(regexp = CURRENCY_PATTERN, message = CURRENCY_MESSAGE) String currency
    ) {
        InsightsResult result = insightsService.generateAllInsights(granularity, currencyOrDefault(currency));
        return ResponseEntity.ok(ApiResponse.success(result, "Insights loaded successfully"));
    }

    @GetMapping("/filter")
    public ResponseEntity<ApiResponse<List<Insight>>> getInsightsForFilter(
            @RequestParam(defaultValue = "THIS_MONTH") TimeFilterPreset preset,
            @RequestParam(required = false) @Pattern(regexp = CURRENCY_PATTERN, message = CURRENCY_MESSAGE) String currency,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        TimeFilter filter;
        if (preset == TimeFilterPreset.CUSTOM) {
            if (start == null || end == null) {
                throw new BadRequestException("start and end are required for a CUSTOM range");
            }
            if (!start.isBefore(end)) {
                throw new BadRequestException("start must be before end");
            }
            filter = TimeFilter.custom(start, end);
        } else {
            filter = TimeFilter.of(preset);
        }
        List<Insight> insights = insightsService.generateAllInsights(filter, currencyOrDefault(currency));
        return ResponseEntity.ok(ApiResponse.success(insights, "Insights loaded successfully"));
    }

    @GetMapping("/health-score")
    public ResponseEntity<ApiResponse<FinancialHealthScore>> getHealthScore(
            @RequestParam(defaultValue = "MONTH") InsightGranularity granularity,
            @RequestParam(required = false) @Pattern(regexp = CURRENCY_PATTERN, message = CURRENCY_MESSAGE) String currency
    ) {
        FinancialHealthScore score = insightsService.computeHealthScore(granularity, currencyOrDefault(currency));
        return ResponseEntity.ok(ApiResponse.success(score, "Health score computed"));
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<ApiResponse<Void>> invalidateCache() {
        insightsService.invalidateCache();
        return ResponseEntity.ok(ApiResponse.success(null, "Insights cache cleared"));
    }

    private String currencyOrDefault(String currency) {
        return currency == null || currency.isBlank() ? properties.defaultCurrency() : currency;
    }
}
