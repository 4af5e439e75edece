package com.buyer.procurement.dto;

import com.buyer.procurement.model.ProjectProcurementStrategy;

public record StrategySettings(
        Long projectId,
        String strategy,
        Integer maxVendors,
        Double minVendorRating,
        boolean allowPartialFulfill) {

    public static StrategySettings of(ProjectProcurementStrategy strategy) {
        return new StrategySettings(strategy.getProject().getId(), strategy.getStrategy(),
                strategy.getMaxVendors(), strategy.getMinVendorRating(), strategy.isAllowPartialFulfill());
    }
}
