package com.buyer.procurement.dto;

public record MitigationAction(
        RiskLevel priority,
        String category,
        String action,
        String impact,
        String effort,
        String timeline) {
}
