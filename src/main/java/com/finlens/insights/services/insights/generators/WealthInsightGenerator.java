package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.AccountItem;
import com.finlens.insights.dto.insights.InsightDetail.AccountListDetail;
import com.finlens.insights.dto.insights.InsightDetail.PeriodTrendDetail;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.entities.Account;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;

@Component
@Order(60)
@RequiredArgsConstructor
public class WealthInsightGenerator implements InsightGenerator {

    private static final double GROWTH_MIN_PERCENT = 1.0;
    static final int DORMANCY_DAYS = 30;

    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        if (context.getAccounts().isEmpty()) {
            return List.of();
        }
        BigDecimal totalWealth = context.totalBalance();
        List<PeriodBucket> cumulative = withCumulativeBalance(context.getBuckets(), totalWealth);

        List<Insight> out = new ArrayList<>();
        out.add(totalWealth(context, totalWealth, cumulative));
        wealthGrowth(context, cumulative).ifPresent(out::add);
        accountDormancy(context).ifPresent(out::add);
        return out;
    }

    /**
     * Walks backwards from today's total so that the last bucket ends at the current balance.
     */
    static List<PeriodBucket> withCumulativeBalance(List<PeriodBucket> buckets, BigDecimal totalWealth) {
        if (buckets == null || buckets.isEmpty()) {
            return List.of();
        }
        BigDecimal totalNet = buckets.stream().map(PeriodBucket::getNetFlow).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal running = totalWealth.subtract(totalNet);
        List<PeriodBucket> out = new ArrayList<>(buckets.size());
        for (PeriodBucket bucket : buckets) {
            running = running.add(bucket.getNetFlow());
            out.add(bucket.withCumulativeBalance(running));
        }
        return out;
    }

    private Insight totalWealth(InsightContext context, BigDecimal totalWealth, List<PeriodBucket> cumulative) {
        InsightTrend trend = null;
        if (cumulative.size() >= 2) {
            PeriodBucket current = cumulative.get(cumulative.size() - 1);
            BigDecimal previous = cumulative.get(cumulative.size() - 2).getCumulativeBalance();
            trend = InsightTrend.builder()
                    .direction(InsightUtils.directionOfSign(current.getNetFlow()))
                    .changePercent(previous.signum() != 0 ? InsightUtils.percentChange(current.getCumulativeBalance(), previous) : null)
                    .changeAbsolute(current.getNetFlow())
                    .comparisonPeriod(context.getGranularity().comparisonPeriodName())
                    .build();
        }
        return Insight.builder()
                .id("total_wealth")
                .type(InsightType.TOTAL_WEALTH)
                .title("Total wealth")
                .subtitle(context.getAccounts().size() + " accounts")
                .metric(formatter.money(totalWealth, context.getBaseCurrency()))
                .trend(trend)
                .severity(totalWealth.signum() >= 0 ? InsightSeverity.POSITIVE : InsightSeverity.CRITICAL)
                .category(InsightCategory.WEALTH)
                .detailData(cumulative.isEmpty() ? null : new PeriodTrendDetail(cumulative))
                .build();
    }

    private Optional<Insight> wealthGrowth(InsightContext context, List<PeriodBucket> cumulative) {
        if (cumulative.size() < 2) {
            return Optional.empty();
        }
        PeriodBucket current = cumulative.get(cumulative.size() - 1);
        BigDecimal previous = cumulative.get(cumulative.size() - 2).getCumulativeBalance();
        if (previous.signum() == 0) {
            return Optional.empty();
        }
        double change = InsightUtils.percentChange(current.getCumulativeBalance(), previous);
        if (Math.abs(change) <= GROWTH_MIN_PERCENT) {
            return Optional.empty();
        }
        return Optional.of(Insight.builder()
                .id("wealth_growth")
                .type(InsightType.WEALTH_GROWTH)
                .title("Wealth growth")
                .subtitle(formatter.signedPercent(change) + " " + context.getGranularity().comparisonPeriodName())
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(change))
                        .formattedValue(formatter.signedPercent(change))
                        .unit("%")
                        .build())
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .changeAbsolute(current.getNetFlow())
                        .comparisonPeriod(context.getGranularity().comparisonPeriodName())
                        .build())
                .severity(current.getNetFlow().signum() > 0 ? InsightSeverity.POSITIVE : InsightSeverity.WARNING)
                .category(InsightCategory.WEALTH)
                .build());
    }

    Optional<Insight> accountDormancy(InsightContext context) {
        Map<String, LocalDate> lastActivity = new HashMap<>();
        for (Transaction tx : context.getAllTransactions()) {
            if (tx == null || tx.getAccountId() == null || tx.getDate() == null) {
                continue;
            }
            lastActivity.merge(tx.getAccountId(), tx.getDate(), (a, b) -> a.isAfter(b) ? a : b);
        }

        LocalDate threshold = context.getToday().minusDays(DORMANCY_DAYS);
        List<AccountItem> dormant = new ArrayList<>();
        for (Account account : context.getAccounts()) {
            if (account == null) {
                continue;
            }
            BigDecimal balance = context.balanceOf(account);
            LocalDate last = lastActivity.get(account.getId());
            if (balance.signum() > 0 && (last == null || last.isBefore(threshold))) {
                dormant.add(new AccountItem(account.getId(), account.getName(), balance, last));
            }
        }
        if (dormant.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal idle = dormant.stream().map(AccountItem::balance).filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(Insight.builder()
                .id("account_dormancy")
                .type(InsightType.ACCOUNT_DORMANCY)
                .title("Idle accounts")
                .subtitle(dormant.size() + " accounts without activity for " + DORMANCY_DAYS + "+ days")
                .metric(formatter.money(idle, context.getBaseCurrency()))
                .severity(InsightSeverity.NEUTRAL)
                .category(InsightCategory.WEALTH)
                .detailData(new AccountListDetail(dormant))
                .build());
    }
}
