package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.util.List;

public record VendorConsolidation(
        Long vendorId,
        String vendorName,
        List<Long> bomItemIds,
        int specificationsCount,
        int totalQuantity,
        BigDecimal totalCostIfUsed,
        double averagePriceRank,
        boolean shippingAdvantage,
        VendorRatingSummary rating) {
}
