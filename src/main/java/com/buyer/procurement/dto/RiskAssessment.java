package com.buyer.procurement.dto;

import java.util.List;
import java.util.Map;

/**
 * Risk findings for one scenario plus the weighted view over them. {@code riskScore}
 * is 0-100 and {@code riskLevel} is graded from it; {@code highestSeverity} is the
 * most severe individual finding.
 */
public record RiskAssessment(
        String strategy,
        int riskScore,
        RiskLevel riskLevel,
        RiskSeverity highestSeverity,
        Map<String, CategoryRisk> categories,
        List<RiskFinding> findings,
        List<MitigationAction> mitigationActions,
        List<String> highPriorityActions) {
}
