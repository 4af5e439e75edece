package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Everything the analysis page shows for one project, computed from a single snapshot. */
public record ProcurementComparison(
        ProjectSummary project,
        StrategySettings strategy,
        LocalDate analysisDate,
        String referenceCurrency,
        List<BomItemAnalysis> items,
        int totalBomItems,
        int coveredItems,
        int uncoveredItems,
        BigDecimal bestCaseCost,
        BigDecimal recommendedCost,
        BigDecimal worstCaseCost,
        BigDecimal savingsVsBudget,
        BigDecimal savingsPercent,
        List<VendorRecommendation> vendorRecommendations,
        List<ScenarioResult> scenarios,
        List<RiskFinding> risks,
        RiskSeverity overallRisk,
        QuoteFreshness quoteFreshness,
        ConsolidationReport consolidation) {
}
