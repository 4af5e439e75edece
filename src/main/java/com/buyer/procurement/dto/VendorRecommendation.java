package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.util.List;

public record VendorRecommendation(
        Long vendorId,
        String vendorName,
        BigDecimal totalCost,
        int itemCount,
        List<Long> bomItemIds,
        String rationale,
        int priority) {
}
