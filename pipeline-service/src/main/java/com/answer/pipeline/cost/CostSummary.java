package com.answer.pipeline.cost;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CostSummary(
        @JsonProperty("daily_total") double dailyTotal,
        @JsonProperty("monthly_total") double monthlyTotal,
        @JsonProperty("daily_budget") double dailyBudget,
        @JsonProperty("monthly_budget") double monthlyBudget,
        @JsonProperty("providers") Map<String, ProviderSpend> providers,
        @JsonProperty("retained_records") int retainedRecords
) {
    public record ProviderSpend(
            @JsonProperty("daily") double daily,
            @JsonProperty("monthly") double monthly,
            @JsonProperty("daily_budget") double dailyBudget,
            @JsonProperty("monthly_budget") double monthlyBudget
    ) {
    }
}
