package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * A complete vendor assignment for a BOM under one strategy. {@code basis} names the
 * candidate a balanced scenario settled on and {@code score} its weighted objective;
 * both are null for the other strategies.
 */
public record ScenarioResult(
        String name,
        String label,
        String description,
        String tradeoffs,
        ScenarioState state,
        BigDecimal totalCost,
        int vendorCount,
        BigDecimal savingsVsBudget,
        List<ItemAssignment> assignments,
        List<String> caveats,
        String basis,
        BigDecimal score) {

    public boolean feasible() {
        return state == ScenarioState.SCORED;
    }
}
