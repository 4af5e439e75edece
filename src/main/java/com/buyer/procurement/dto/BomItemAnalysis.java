package com.buyer.procurement.dto;

import java.math.BigDecimal;

public record BomItemAnalysis(
        Long bomItemId,
        Long specificationId,
        String specificationName,
        int quantity,
        int quoteCount,
        int vendorCount,
        QuoteSelection bestSelection,
        ItemAssignment recommended,
        BigDecimal bestLineCost,
        BigDecimal recommendedLineCost,
        String riskLevel) {
}
