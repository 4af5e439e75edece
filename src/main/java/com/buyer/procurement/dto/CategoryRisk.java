package com.buyer.procurement.dto;

import java.util.List;

/**
 * One risk category of an assessment. {@code score} is 0-100; {@code affectedItems}
 * counts BOM lines for item categories and vendors for the quality category.
 */
public record CategoryRisk(
        String category,
        RiskLevel level,
        int score,
        int affectedItems,
        List<String> issues,
        String estimatedImpact) {
}
