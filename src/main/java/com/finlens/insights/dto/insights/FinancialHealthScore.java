package com.finlens.insights.dto.insights;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FinancialHealthScore {

    public static final String GRADE_UNAVAILABLE = "Unavailable";

    int score;
    String grade;
    int savingsRateScore;
    int budgetAdherenceScore;
    int recurringRatioScore;
    int emergencyFundScore;
    int cashflowScore;

    public static FinancialHealthScore unavailable() {
        return FinancialHealthScore.builder().score(0).grade(GRADE_UNAVAILABLE).build();
    }

    public boolean isAvailable() {
        return !GRADE_UNAVAILABLE.equals(grade);
    }
}
