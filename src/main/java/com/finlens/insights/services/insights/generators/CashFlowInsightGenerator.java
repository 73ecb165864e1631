package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.PeriodTrendDetail;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;
import com.finlens.insights.services.insights.RecurringCostCalculator;

import lombok.RequiredArgsConstructor;

/**
 * Cash-flow insights read straight from the period buckets of the pass.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class CashFlowInsightGenerator implements InsightGenerator {

    private final RecurringCostCalculator recurringCostCalculator;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<PeriodBucket> buckets = context.getBuckets();
        if (buckets == null || buckets.size() < 2) {
            return List.of();
        }
        List<Insight> out = new ArrayList<>();
        out.add(netCashFlow(context, buckets));

        PeriodBucket best = buckets.stream().max(Comparator.comparing(PeriodBucket::getNetFlow)).orElseThrow();
        out.add(bestPeriod(context, best));
        worstPeriod(context, buckets, best).ifPresent(out::add);
        projectedBalance(context).ifPresent(out::add);
        return out;
    }

    private Insight netCashFlow(InsightContext context, List<PeriodBucket> buckets) {
        PeriodBucket latest = context.currentBucket().orElse(buckets.get(buckets.size() - 1));
        BigDecimal net = latest.getNetFlow();
        double average = InsightUtils.mean(buckets.stream().map(PeriodBucket::getNetFlow).toList());
        BigDecimal averageNet = BigDecimal.valueOf(average);
        double change = InsightUtils.percentChange(net, averageNet);

        return Insight.builder()
                .id("net_cashflow")
                .type(InsightType.NET_CASH_FLOW)
                .title("Net cash flow")
                .subtitle(latest.getLabel())
                .metric(formatter.money(net, context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(averageNet.signum() != 0 ? change : null)
                        .changeAbsolute(net.subtract(averageNet))
                        .comparisonPeriod("vs average " + context.getGranularity().periodNoun())
                        .build())
                .severity(InsightUtils.severityOfSign(net))
                .category(InsightCategory.CASH_FLOW)
                .detailData(new PeriodTrendDetail(buckets))
                .build();
    }

    private Insight bestPeriod(InsightContext context, PeriodBucket best) {
        return Insight.builder()
                .id("best_month")
                .type(InsightType.BEST_PERIOD)
                .title("Best " + context.getGranularity().periodNoun())
                .subtitle(best.getLabel())
                .metric(formatter.money(best.getNetFlow(), context.getBaseCurrency()))
                .severity(InsightSeverity.POSITIVE)
                .category(InsightCategory.CASH_FLOW)
                .build();
    }

    private Optional<Insight> worstPeriod(InsightContext context, List<PeriodBucket> buckets, PeriodBucket best) {
        PeriodBucket worst = buckets.stream().min(Comparator.comparing(PeriodBucket::getNetFlow)).orElseThrow();
        if (worst.getNetFlow().signum() >= 0 || worst.getKey().equals(best.getKey())) {
            return Optional.empty();
        }
        return Optional.of(Insight.builder()
                .id("worst_month")
                .type(InsightType.WORST_PERIOD)
                .title("Worst " + context.getGranularity().periodNoun())
                .subtitle(worst.getLabel())
                .metric(formatter.money(worst.getNetFlow(), context.getBaseCurrency()))
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.CASH_FLOW)
                .build());
    }

    private Optional<Insight> projectedBalance(InsightContext context) {
        List<RecurringSeries> active = context.getRecurringSeries().stream().filter(RecurringSeries::isActive).toList();
        if (active.isEmpty()) {
            return Optional.empty();
        }
        String currency = context.getBaseCurrency();
        BigDecimal projection = recurringCostCalculator.monthlyNet(active, context.getCategories(), currency)
                .multiply(context.getGranularity().monthlyMultiplier());
        BigDecimal projected = context.totalBalance().add(projection);

        return Optional.of(Insight.builder()
                .id("projected_balance")
                .type(InsightType.PROJECTED_BALANCE)
                .title("Projected balance")
                .subtitle("After next " + context.getGranularity().periodNoun() + " of recurring payments")
                .metric(formatter.money(projected, currency))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.directionOfSign(projection))
                        .changeAbsolute(projection)
                        .comparisonPeriod("vs current balance")
                        .build())
                .severity(projected.signum() >= 0 ? InsightSeverity.POSITIVE : InsightSeverity.CRITICAL)
                .category(InsightCategory.CASH_FLOW)
                .build());
    }
}
