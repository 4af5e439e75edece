package com.buyer.procurement.dto;

import java.util.List;

/** {@code vendorId} is set only for findings about a vendor. */
public record RiskFinding(
        RiskKind kind,
        RiskSeverity severity,
        String message,
        Long vendorId,
        List<Long> bomItemIds) {
}
