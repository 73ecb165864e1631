package com.finlens.insights.services.insights;

import java.time.ZoneId;
import java.util.Locale;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.TimeFilterPreset;

public final class InsightsCacheKeys {

    private InsightsCacheKeys() {
    }

    /**
     * {@code <PRESET>_<CURRENCY>_<windowStartEpochSeconds>}. Custom ranges also carry the window end,
     * since two custom ranges may share a start.
     */
    public static String forTimeFilter(TimeFilterPreset preset, String baseCurrency, DateWindow window, ZoneId zone) {
        String key = preset.name() + "_" + normalizeCurrency(baseCurrency) + "_"
                + window.start().atStartOfDay(zone).toEpochSecond();
        if (preset == TimeFilterPreset.CUSTOM) {
            key += "_" + window.end().atStartOfDay(zone).toEpochSecond();
        }
        return key;
    }

    public static String forGranularity(InsightGranularity granularity, String baseCurrency) {
        return "granularity_" + granularity.name() + "_" + normalizeCurrency(baseCurrency);
    }

    public static String normalizeCurrency(String currency) {
        return currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
    }
}
