package com.buyer.procurement.engine;

import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.exception.InvalidStrategyException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * The closed set of vendor selection strategies. Each one carries the comparator used
 * to pick a quote within an item's best constraint tier; how the per-item picks are
 * combined into a scenario lives in {@link ScenarioEvaluator}.
 */
public enum StrategyType {
    LOWEST_COST("lowest_cost", "Lowest Cost",
            "Minimizes total cost by selecting cheapest vendor for each item independently",
            "Highest savings, but may involve many vendors (increased admin overhead)"),
    FEWEST_VENDORS("fewest_vendors", "Fewest Vendors",
            "Minimizes number of vendors to reduce administrative complexity",
            "Simplifies ordering/management, but may cost slightly more than lowest cost"),
    BALANCED("balanced", "Balanced",
            "Optimizes both cost and vendor count for best overall value",
            "Good balance between savings and simplicity"),
    QUALITY_FOCUSED("quality_focused", "Quality Focused",
            "Prioritizes vendors with highest quality ratings",
            "Higher quality/reliability, may have higher costs") {
        @Override
        public Comparator<QuoteComparison> quoteOrder(ToDoubleFunction<Long> vendorQuality) {
            return Comparator.comparingDouble((QuoteComparison q) -> vendorQuality.applyAsDouble(q.vendorId()))
                    .reversed()
                    .thenComparing(QuoteComparisonBuilder.PRICE_ORDER);
        }
    };

    public static final StrategyType DEFAULT = BALANCED;

    private final String code;
    private final String label;
    private final String description;
    private final String tradeoffs;

    StrategyType(String code, String label, String description, String tradeoffs) {
        this.code = code;
        this.label = label;
        this.description = description;
        this.tradeoffs = tradeoffs;
    }

    /** Order in which quotes inside one constraint tier are preferred. */
    public Comparator<QuoteComparison> quoteOrder(ToDoubleFunction<Long> vendorQuality) {
        return QuoteComparisonBuilder.PRICE_ORDER;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public String getTradeoffs() {
        return tradeoffs;
    }

    public static StrategyType fromCode(String code) {
        if (code == null) {
            throw new InvalidStrategyException(null);
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidStrategyException(code));
    }
}
